package com.foamcase.store;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Substitutes {@code ${NAME}} placeholders; names missing from the environment expand to nothing. */
final class EnvironmentExpander {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{(.+?)\\}");

    private final Map<String, String> environment;

    EnvironmentExpander(Map<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    String expand(String raw) {
        Matcher matcher = PLACEHOLDER.matcher(raw);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = environment.getOrDefault(matcher.group(1), "");
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
