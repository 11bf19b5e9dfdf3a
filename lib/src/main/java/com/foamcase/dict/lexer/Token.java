package com.foamcase.dict.lexer;

import com.foamcase.dict.value.FoamFloat;
import com.foamcase.dict.value.FoamInt;
import com.foamcase.dict.value.FoamString;
import com.foamcase.dict.value.FoamValue;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A lexical token, or a marker standing for an already reduced region of the stream. {@code text} is the
 * textual value used when tokens are stitched together; {@code value} is the tree node the token contributes
 * once it ends up inside a tuple, list or pair.
 */
public final class Token {
    private final TokenKind kind;
    private final String text;
    private final FoamValue value;
    private final List<FoamValue> pairValues;
    private final int line;
    private final int column;

    private Token(
            TokenKind kind, String text, FoamValue value, List<FoamValue> pairValues, int line, int column) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text");
        this.value = value;
        this.pairValues = pairValues;
        this.line = line;
        this.column = column;
    }

    public static Token punctuation(char symbol, int line, int column) {
        return new Token(TokenKind.PUNCTUATION, String.valueOf(symbol), null, null, line, column);
    }

    public static Token name(String text, int line, int column) {
        return new Token(TokenKind.NAME, text, new FoamString(text), null, line, column);
    }

    public static Token integer(String lexeme, long number, int line, int column) {
        return new Token(TokenKind.INT, lexeme, new FoamInt(number), null, line, column);
    }

    public static Token floating(String lexeme, double number, int line, int column) {
        return new Token(TokenKind.FLOAT, lexeme, new FoamFloat(number), null, line, column);
    }

    public static Token string(String text, int line, int column) {
        return new Token(TokenKind.STRING, text, new FoamString(text), null, line, column);
    }

    /** A reduced region, positioned where the region started. */
    public static Token value(FoamValue value, Token start) {
        Objects.requireNonNull(value, "value");
        return new Token(TokenKind.VALUE, value.toString(), value, null, start.line, start.column);
    }

    public static Token pair(Token name, List<FoamValue> values) {
        return new Token(TokenKind.PAIR, name.text, null, List.copyOf(values), name.line, name.column);
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    /** The node this token stands for. Punctuation and pair tokens have none. */
    public FoamValue getValue() {
        if (value == null) {
            throw new IllegalStateException(kind + " token has no value: " + this);
        }
        return value;
    }

    public List<FoamValue> getPairValues() {
        if (kind != TokenKind.PAIR) {
            throw new IllegalStateException("Not a pair token: " + this);
        }
        return pairValues;
    }

    public boolean isPunctuation(char symbol) {
        return kind == TokenKind.PUNCTUATION && text.charAt(0) == symbol;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Token)) {
            return false;
        }
        Token other = (Token) obj;
        return kind == other.kind
                && text.equals(other.text)
                && Objects.equals(value, other.value)
                && Objects.equals(pairValues, other.pairValues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, value, pairValues);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ROOT) + "(" + text + ")";
    }
}
