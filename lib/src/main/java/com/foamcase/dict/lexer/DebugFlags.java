package com.foamcase.dict.lexer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

public final class DebugFlags {
    private static final Logger LOGGER = Logger.getLogger(DebugFlags.class.getName());
    private static final String TOKENS_PROPERTY = "foamcase.debugTokens";
    /** Environment fallback kept for convenience; prefer using system properties. */
    private static final String TOKENS_ENV = "FOAMCASE_DEBUG_TOKENS";
    /** Only the most recent lines are kept; one-shot parses never drain the capture. */
    static final int CAPTURE_LIMIT = 1000;
    private static final ThreadLocal<Deque<String>> CAPTURED_TOKENS =
            ThreadLocal.withInitial(ArrayDeque::new);

    private DebugFlags() {}

    public static boolean isTokenDebugEnabled() {
        String value = System.getProperty(TOKENS_PROPERTY);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(TOKENS_ENV));
    }

    public static void logTokens(String sourceName, List<Token> tokens) {
        LOGGER.info("Token dump for " + sourceName + ":");
        for (Token token : tokens) {
            String line =
                    String.format(
                            Locale.ROOT,
                            "%-12s @ %4d:%-3d -> %s",
                            token.getKind(),
                            token.getLine(),
                            token.getColumn(),
                            token.getText());
            LOGGER.info("  " + line);
            Deque<String> captured = CAPTURED_TOKENS.get();
            if (captured.size() == CAPTURE_LIMIT) {
                captured.removeFirst();
            }
            captured.addLast(line);
        }
    }

    public static List<String> drainCapturedTokens() {
        List<String> captured = new ArrayList<>(CAPTURED_TOKENS.get());
        CAPTURED_TOKENS.get().clear();
        return captured;
    }
}
