package com.foamcase.dict.parser;

import com.foamcase.dict.lexer.Token;

/** The text does not follow the dictionary grammar. No partial tree is ever returned alongside it. */
public final class FoamParseException extends Exception {
    public FoamParseException(String message) {
        super(message);
    }

    public FoamParseException(String message, Throwable cause) {
        super(message, cause);
    }

    static FoamParseException at(Token token, String message) {
        return new FoamParseException("line " + token.getLine() + ":" + token.getColumn() + " " + message);
    }
}
