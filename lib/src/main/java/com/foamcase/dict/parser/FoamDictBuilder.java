package com.foamcase.dict.parser;

import com.foamcase.dict.value.FoamBool;
import com.foamcase.dict.value.FoamDict;
import com.foamcase.dict.value.FoamDictTuple;
import com.foamcase.dict.value.FoamFloat;
import com.foamcase.dict.value.FoamInt;
import com.foamcase.dict.value.FoamList;
import com.foamcase.dict.value.FoamMapping;
import com.foamcase.dict.value.FoamMultiValue;
import com.foamcase.dict.value.FoamSequence;
import com.foamcase.dict.value.FoamString;
import com.foamcase.dict.value.FoamTuple;
import com.foamcase.dict.value.FoamValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Writes a dictionary tree back as grammar text, one entry per line. Comments and the original layout are
 * not preserved, but the output parses back to an equal tree.
 */
public final class FoamDictBuilder {

    private static final String SPECIAL_CHARACTERS = "{}[]();\"'\\";
    // Same shapes as the lexer's INT and FLOAT rules.
    private static final Pattern NUMBER =
            Pattern.compile("[+-]?(?:[0-9]+\\.[0-9]*|\\.[0-9]+|[0-9]+)(?:[eE][+-]?[0-9]+)?");

    public String build(FoamMapping dictionary) {
        Objects.requireNonNull(dictionary, "dictionary");
        List<String> lines = new ArrayList<>();
        for (Map.Entry<String, FoamValue> entry : dictionary.entries()) {
            FoamValue value = entry.getValue();
            String rendered = buildValue(value);
            if (rendered.indexOf('\n') >= 0) {
                lines.add(entry.getKey());
                // A closing brace already terminates its pair; every other block needs the semicolon.
                lines.add(value instanceof FoamDict ? rendered : rendered + ";");
            } else {
                lines.add(entry.getKey() + " " + rendered + ";");
            }
        }
        return String.join("\n", lines);
    }

    private String buildValue(FoamValue value) {
        if (value instanceof FoamBool bool) {
            return bool.getValue() ? "true" : "false";
        } else if (value instanceof FoamInt number) {
            return Long.toString(number.getValue());
        } else if (value instanceof FoamFloat number) {
            if (!Double.isFinite(number.getValue())) {
                throw new IllegalArgumentException("Cannot write non-finite float " + number.getValue());
            }
            return Double.toString(number.getValue());
        } else if (value instanceof FoamString string) {
            return buildString(string.getValue());
        } else if (value instanceof FoamList list) {
            return "[" + joinElements(list) + "]";
        } else if (value instanceof FoamTuple tuple) {
            return "(" + joinElements(tuple) + ")";
        } else if (value instanceof FoamMultiValue multiValue) {
            return joinElements(multiValue);
        } else if (value instanceof FoamMapping mapping) {
            if (mapping.isEmpty()) {
                return "{}";
            }
            String inner = build(mapping);
            return mapping instanceof FoamDictTuple ? "(\n" + inner + "\n)" : "{\n" + inner + "\n}";
        }
        throw new IllegalStateException("Unsupported value type: " + value.getClass().getName());
    }

    private String joinElements(FoamSequence sequence) {
        List<String> parts = new ArrayList<>(sequence.size());
        for (FoamValue element : sequence.getElements()) {
            parts.add(buildValue(element));
        }
        return String.join(" ", parts);
    }

    static String buildString(String text) {
        if (needsQuotes(text)) {
            return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        }
        return text;
    }

    private static boolean needsQuotes(String text) {
        if (text.isEmpty() || text.startsWith("//") || text.startsWith("/*")) {
            return true;
        }
        for (int i = 0; i < text.length(); i++) {
            char current = text.charAt(i);
            if (Character.isWhitespace(current) || SPECIAL_CHARACTERS.indexOf(current) >= 0) {
                return true;
            }
        }
        // Unquoted, these would come back as numbers.
        return NUMBER.matcher(text).matches();
    }
}
