package com.foamcase.dict.parser;

import com.foamcase.dict.lexer.FoamTokenizer;
import com.foamcase.dict.lexer.Token;
import com.foamcase.dict.lexer.TokenKind;
import com.foamcase.dict.value.FoamDict;
import com.foamcase.dict.value.FoamDictTuple;
import com.foamcase.dict.value.FoamList;
import com.foamcase.dict.value.FoamMapping;
import com.foamcase.dict.value.FoamMultiValue;
import com.foamcase.dict.value.FoamTuple;
import com.foamcase.dict.value.FoamValue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Reduces a token stream to a dictionary tree. Reduction runs as a fixed sequence of passes, each one
 * replacing every region of its kind with a single {@link TokenKind#VALUE} token before the next pass starts:
 *
 * <ol>
 *   <li>quoted strings are stitched into one string token;
 *   <li>outermost {@code {...}} blocks are parsed recursively into dictionaries;
 *   <li>{@code (...)} regions, innermost first, become tuples, or dictionary tuples when punctuation is
 *       still left inside them;
 *   <li>{@code [...]} regions the same way, giving lists or dictionaries;
 *   <li>each name and the values up to its {@code ;} become a pair.
 * </ol>
 *
 * <p>The remaining pairs are then assembled into the resulting dictionary. Later passes rely on the earlier
 * ones having run to completion, which is what makes {@code (a 1;)} a dictionary tuple while {@code (a 1)}
 * stays a plain tuple.
 */
public final class FoamDictParser {

    private final FoamTokenizer tokenizer = new FoamTokenizer();

    public FoamDict parse(String input) throws FoamParseException {
        return parse(tokenizer.tokenize(input));
    }

    public FoamDict parse(String sourceName, String input) throws FoamParseException {
        return parse(tokenizer.tokenize(sourceName, input));
    }

    public FoamDict parse(List<Token> tokens) throws FoamParseException {
        Objects.requireNonNull(tokens, "tokens");
        return reduce(tokens, FoamDict::new);
    }

    private static <M extends FoamMapping> M reduce(List<Token> tokens, Supplier<M> mapping)
            throws FoamParseException {
        if (tokens.isEmpty()) {
            return mapping.get();
        }
        List<Token> reduced = stitchQuotedStrings(tokens);
        reduced = reduceSubdictionaries(reduced);
        reduced = reduceBrackets(reduced, '(', ')');
        reduced = reduceBrackets(reduced, '[', ']');
        reduced = reducePairs(reduced);
        return assemble(reduced, mapping.get());
    }

    private static List<Token> stitchQuotedStrings(List<Token> tokens) throws FoamParseException {
        List<Token> out = new ArrayList<>(tokens.size());
        Token opening = null;
        int start = -1;
        for (Token token : tokens) {
            boolean quote = token.isPunctuation('"') || token.isPunctuation('\'');
            if (quote && opening == null) {
                opening = token;
                start = out.size();
                out.add(token);
            } else if (quote && token.getText().equals(opening.getText())) {
                StringBuilder text = new StringBuilder();
                for (Token inner : out.subList(start + 1, out.size())) {
                    text.append(inner.getText());
                }
                out.subList(start, out.size()).clear();
                out.add(Token.string(text.toString(), opening.getLine(), opening.getColumn()));
                opening = null;
            } else {
                // The other quote character is literal text inside an open string.
                out.add(token);
            }
        }
        if (opening != null) {
            throw FoamParseException.at(opening, "Unmatched quote " + opening.getText());
        }
        return out;
    }

    private static List<Token> reduceSubdictionaries(List<Token> tokens) throws FoamParseException {
        List<Token> out = new ArrayList<>(tokens.size());
        int depth = 0;
        int start = -1;
        for (Token token : tokens) {
            if (token.isPunctuation('{')) {
                depth++;
                if (depth == 1) {
                    start = out.size();
                }
                out.add(token);
            } else if (token.isPunctuation('}')) {
                depth--;
                if (depth < 0) {
                    throw FoamParseException.at(token, "Unmatched '}'");
                }
                if (depth == 0) {
                    Token opening = out.get(start);
                    List<Token> interior = new ArrayList<>(out.subList(start + 1, out.size()));
                    out.subList(start, out.size()).clear();
                    out.add(Token.value(reduce(interior, FoamDict::new), opening));
                } else {
                    out.add(token);
                }
            } else {
                out.add(token);
            }
        }
        if (depth > 0) {
            throw FoamParseException.at(out.get(start), "Unmatched '{'");
        }
        return out;
    }

    private static List<Token> reduceBrackets(List<Token> tokens, char open, char close)
            throws FoamParseException {
        List<Token> out = new ArrayList<>(tokens.size());
        Deque<Integer> openings = new ArrayDeque<>();
        for (Token token : tokens) {
            if (token.isPunctuation(open)) {
                openings.push(out.size());
                out.add(token);
            } else if (token.isPunctuation(close)) {
                if (openings.isEmpty()) {
                    throw FoamParseException.at(token, "Unmatched '" + close + "'");
                }
                int start = openings.pop();
                Token opening = out.get(start);
                List<Token> interior = new ArrayList<>(out.subList(start + 1, out.size()));
                out.subList(start, out.size()).clear();
                out.add(Token.value(reduceRegion(interior, open), opening));
            } else {
                out.add(token);
            }
        }
        if (!openings.isEmpty()) {
            throw FoamParseException.at(out.get(openings.peekLast()), "Unmatched '" + open + "'");
        }
        return out;
    }

    private static FoamValue reduceRegion(List<Token> interior, char open) throws FoamParseException {
        boolean structured = false;
        for (Token token : interior) {
            if (token.getKind() == TokenKind.PUNCTUATION) {
                structured = true;
                break;
            }
        }
        if (structured) {
            return open == '(' ? reduce(interior, FoamDictTuple::new) : reduce(interior, FoamDict::new);
        }
        List<FoamValue> elements = new ArrayList<>(interior.size());
        for (Token token : interior) {
            elements.add(token.getValue());
        }
        return open == '(' ? new FoamTuple(elements) : new FoamList(elements);
    }

    private static List<Token> reducePairs(List<Token> tokens) throws FoamParseException {
        List<Token> out = new ArrayList<>();
        Token name = null;
        List<FoamValue> values = new ArrayList<>();
        for (Token token : tokens) {
            if (token.getKind() == TokenKind.PUNCTUATION) {
                if (!token.isPunctuation(';')) {
                    throw FoamParseException.at(token, "Unexpected " + token);
                }
                if (name == null) {
                    throw FoamParseException.at(token, "Unmatched ';'");
                }
                out.add(closePair(name, values));
                name = null;
                values = new ArrayList<>();
            } else if (name == null && token.getKind() == TokenKind.NAME) {
                name = token;
            } else if (name != null) {
                values.add(token.getValue());
            } else {
                // Left for assembly to reject; it belongs to no pair.
                out.add(token);
            }
        }
        if (name != null) {
            out.add(closePair(name, values));
        }
        return out;
    }

    private static Token closePair(Token name, List<FoamValue> values) throws FoamParseException {
        if (values.isEmpty()) {
            throw FoamParseException.at(name, "Name '" + name.getText() + "' has no value");
        }
        return Token.pair(name, values);
    }

    private static <M extends FoamMapping> M assemble(List<Token> tokens, M mapping)
            throws FoamParseException {
        for (Token token : tokens) {
            if (token.getKind() != TokenKind.PAIR) {
                throw FoamParseException.at(token, "Unexpected " + token + " outside of a key/value pair");
            }
            List<FoamValue> values = token.getPairValues();
            FoamValue value = values.size() == 1 ? values.get(0) : new FoamMultiValue(values);
            if (mapping.putIfAbsent(token.getText(), value) != null) {
                throw FoamParseException.at(token, "Duplicate key '" + token.getText() + "'");
            }
        }
        return mapping;
    }
}
