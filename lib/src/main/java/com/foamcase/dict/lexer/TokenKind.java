package com.foamcase.dict.lexer;

public enum TokenKind {
    // Lexical
    PUNCTUATION,
    NAME,
    INT,
    FLOAT,
    STRING,
    // Produced while reducing, never by the tokenizer
    VALUE,
    PAIR
}
