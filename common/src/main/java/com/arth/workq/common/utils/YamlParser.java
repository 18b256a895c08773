package com.arth.workq.common.utils;

import com.arth.workq.common.constant.LoggerName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Simple YAML parser for loading configuration files.
 * Only nested maps of scalars are supported; nested keys are flattened with dots
 * ({@code store:\n  dir: x} becomes {@code store.dir=x}).
 */
public class YamlParser {

    private static final Logger log = LoggerFactory.getLogger(LoggerName.CONFIG);

    /**
     * Parse a YAML file into a map of key-value pairs
     *
     * @param filePath Path to the YAML file
     * @return Map containing configuration key-value pairs
     * @throws IOException If an error occurs while reading the file
     */
    public static Map<String, String> parseYaml(String filePath) throws IOException {
        try (Reader reader = new FileReader(filePath)) {
            return parse(reader);
        }
    }

    /**
     * Parse YAML text held in memory.
     */
    public static Map<String, String> parseYamlString(String yaml) {
        try {
            return parse(new StringReader(yaml));
        } catch (IOException e) {
            throw new IllegalStateException("Unexpected I/O error reading in-memory YAML", e);
        }
    }

    private static Map<String, String> parse(Reader source) throws IOException {
        Map<String, String> configMap = new HashMap<>();
        try (BufferedReader reader = new BufferedReader(source)) {
            String line;
            Deque<String> keyStack = new ArrayDeque<>();
            Deque<Integer> indentStack = new ArrayDeque<>();
            indentStack.push(-1);

            while ((line = reader.readLine()) != null) {
                String trimmedLine = stripComment(line).trim();
                if (trimmedLine.isEmpty()) {
                    continue;
                }

                int indent = 0;
                while (indent < line.length() && line.charAt(indent) == ' ') {
                    indent++;
                }

                int colonIndex = trimmedLine.indexOf(':');
                if (colonIndex <= 0) {
                    continue;
                }

                String key = trimmedLine.substring(0, colonIndex).trim();
                String value = trimmedLine.substring(colonIndex + 1).trim();

                while (indent <= indentStack.peek()) {
                    indentStack.pop();
                    if (!keyStack.isEmpty()) keyStack.pop();
                }

                String fullKey = key;
                if (!keyStack.isEmpty()) {
                    // keyStack is LIFO, join from the outermost key
                    StringBuilder prefix = new StringBuilder();
                    keyStack.descendingIterator().forEachRemaining(k -> prefix.append(k).append('.'));
                    fullKey = prefix + key;
                }

                if (value.isEmpty()) {
                    // It's a parent key
                    keyStack.push(key);
                    indentStack.push(indent);
                } else {
                    // Remove quotes if present
                    if (value.length() >= 2 && ((value.startsWith("'") && value.endsWith("'")) ||
                            (value.startsWith("\"") && value.endsWith("\"")))) {
                        value = value.substring(1, value.length() - 1);
                    }
                    configMap.put(fullKey, value);
                }
            }
        }
        return configMap;
    }

    private static String stripComment(String line) {
        if (line.trim().startsWith("#")) {
            return "";
        }
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if ((c == '"' || c == '\'') && (i == 0 || Character.isWhitespace(line.charAt(i - 1)))) {
                quote = c;
            } else if (c == '#' && i > 0 && Character.isWhitespace(line.charAt(i - 1))) {
                return line.substring(0, i);
            }
        }
        return line;
    }

    /**
     * Get an integer value from the config map, with a default fallback
     *
     * @param configMap    Config map
     * @param key          Config key
     * @param defaultValue Default value if key not found
     * @return Integer value or default
     */
    public static int getIntValue(Map<String, String> configMap, String key, int defaultValue) {
        String value = configMap.get(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid number for config key {}: '{}', using default {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    /**
     * Get a string value from the config map, with a default fallback
     */
    public static String getStringValue(Map<String, String> configMap, String key, String defaultValue) {
        String value = configMap.get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Get a boolean value from the config map, with a default fallback
     */
    public static boolean getBooleanValue(Map<String, String> configMap, String key, boolean defaultValue) {
        String value = configMap.get(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    /**
     * Get a long value from the config map, with a default fallback
     */
    public static long getLongValue(Map<String, String> configMap, String key, long defaultValue) {
        String value = configMap.get(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid number for config key {}: '{}', using default {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    /**
     * Get an enum constant by (case-insensitive) name, with a default fallback
     */
    public static <E extends Enum<E>> E getEnumValue(Map<String, String> configMap, String key, E defaultValue) {
        String value = configMap.get(key);
        if (value != null) {
            try {
                return Enum.valueOf(defaultValue.getDeclaringClass(), value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                log.warn("Unknown value for config key {}: '{}', using default {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }
}
