package fr.lapetina.aigateway.infrastructure.config;

import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code ${NAME}} and {@code ${NAME:default}} references in configuration values.
 */
final class EnvironmentResolver {

    private static final Pattern REFERENCE = Pattern.compile("\\$\\{([A-Za-z0-9_.]+)(?::([^}]*))?}");

    private static volatile Function<String, String> lookup = System::getenv;

    private EnvironmentResolver() {
        // Utility class
    }

    static String resolve(String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }
        Matcher matcher = REFERENCE.matcher(value);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String resolved = lookup.apply(matcher.group(1));
            if (resolved == null) {
                resolved = matcher.group(2) != null ? matcher.group(2) : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(resolved));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Replaces the variable source. For tests.
     */
    static void useVariables(Map<String, String> variables) {
        lookup = variables::get;
    }

    static void useSystemEnvironment() {
        lookup = System::getenv;
    }
}
