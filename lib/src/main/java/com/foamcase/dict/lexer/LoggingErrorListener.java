package com.foamcase.dict.lexer;

import java.util.logging.Logger;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/** Routes lexer recovery messages to the log instead of stderr; tokenizing itself never fails. */
final class LoggingErrorListener extends BaseErrorListener {
    static final LoggingErrorListener INSTANCE = new LoggingErrorListener();

    private static final Logger LOGGER = Logger.getLogger(LoggingErrorListener.class.getName());

    private LoggingErrorListener() {}

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        LOGGER.warning("line " + line + ":" + (charPositionInLine + 1) + " " + msg);
    }
}
