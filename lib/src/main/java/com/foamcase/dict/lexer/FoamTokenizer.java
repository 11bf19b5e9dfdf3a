package com.foamcase.dict.lexer;

import com.foamcase.dict.grammar.FoamDictLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;

/**
 * Turns dictionary text into the token stream consumed by the structural parser. The ANTLR lexer does the
 * character-level work; this class maps its token types onto {@link TokenKind} and applies the two stream
 * rewrites the grammar relies on:
 *
 * <ul>
 *   <li>every closing brace is followed by a {@code ;} token, whether or not the source wrote one directly
 *       after it, so each block terminates the pair it belongs to;
 *   <li>a quoted literal becomes an opening quote, its unescaped body and, if the source closed it, a closing
 *       quote. The parser's quote stitching reports a literal that was never closed.
 * </ul>
 *
 * <p>Tokenizing never fails. Input that looks numeric but is not a well-formed number, or does not fit a
 * double, comes back as a name.
 */
public final class FoamTokenizer {

    public List<Token> tokenize(String input) {
        return tokenize("<input>", input);
    }

    public List<Token> tokenize(String sourceName, String input) {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(input, "input");

        FoamDictLexer lexer = new FoamDictLexer(CharStreams.fromString(input, sourceName));
        lexer.removeErrorListeners();
        lexer.addErrorListener(LoggingErrorListener.INSTANCE);

        CommonTokenStream stream = new CommonTokenStream(lexer);
        stream.fill();

        List<Token> tokens = new ArrayList<>();
        for (org.antlr.v4.runtime.Token raw : stream.getTokens()) {
            if (raw.getType() == org.antlr.v4.runtime.Token.EOF) {
                break;
            }
            translate(raw, tokens);
        }
        if (DebugFlags.isTokenDebugEnabled()) {
            DebugFlags.logTokens(sourceName, tokens);
        }
        return tokens;
    }

    private static void translate(org.antlr.v4.runtime.Token raw, List<Token> out) {
        String text = raw.getText();
        int line = raw.getLine();
        int column = raw.getCharPositionInLine() + 1;
        switch (raw.getType()) {
            case FoamDictLexer.LPAREN,
                    FoamDictLexer.RPAREN,
                    FoamDictLexer.LBRACE,
                    FoamDictLexer.LBRACKET,
                    FoamDictLexer.RBRACKET,
                    FoamDictLexer.SEMI -> out.add(Token.punctuation(text.charAt(0), line, column));
            case FoamDictLexer.RBRACE -> {
                out.add(Token.punctuation('}', line, column));
                out.add(Token.punctuation(';', line, column + 1));
            }
            case FoamDictLexer.DQ_STRING, FoamDictLexer.SQ_STRING -> addQuoted(text, line, column, out);
            case FoamDictLexer.INT -> out.add(integer(text, line, column));
            case FoamDictLexer.FLOAT -> out.add(floating(text, line, column));
            default -> out.add(Token.name(text, line, column));
        }
    }

    private static Token integer(String text, int line, int column) {
        try {
            return Token.integer(text, Long.parseLong(text), line, column);
        } catch (NumberFormatException ex) {
            // Outside the 64-bit range; keep the magnitude rather than failing.
            return floating(text, line, column);
        }
    }

    /** A literal beyond the double range stays a name, like any other malformed number. */
    private static Token floating(String text, int line, int column) {
        double number = Double.parseDouble(text);
        if (Double.isInfinite(number)) {
            return Token.name(text, line, column);
        }
        return Token.floating(text, number, line, column);
    }

    private static void addQuoted(String text, int line, int column, List<Token> out) {
        char quote = text.charAt(0);
        StringBuilder body = new StringBuilder();
        boolean escape = false;
        boolean terminated = false;
        for (int i = 1; i < text.length(); i++) {
            char current = text.charAt(i);
            if (escape) {
                body.append(current);
                escape = false;
            } else if (current == '\\') {
                escape = true;
            } else if (current == quote) {
                terminated = true;
                break;
            } else {
                body.append(current);
            }
        }
        out.add(Token.punctuation(quote, line, column));
        out.add(Token.string(body.toString(), line, column + 1));
        if (terminated) {
            out.add(Token.punctuation(quote, line, column + text.length() - 1));
        }
    }
}
