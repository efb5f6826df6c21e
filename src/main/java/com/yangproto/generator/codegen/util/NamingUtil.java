package com.yangproto.generator.codegen.util;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Utility for consistent proto and Java naming conventions.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts yang-name or yang_name to PascalCase. Every letter that follows a
     * non-letter starts a new word, so {@code ipv4-address} becomes {@code Ipv4Address}.
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Arrays.stream(name.split("[-_]+"))
                .map(NamingUtil::titleCase)
                .collect(Collectors.joining(""));
    }

    /**
     * Proto field identifier: hyphens become underscores.
     */
    public static String toFieldName(String name) {
        return name == null ? null : name.replace('-', '_');
    }

    /**
     * Java package segment for a module, e.g. {@code sonic-system} to {@code sonic_system}.
     */
    public static String toPackageSegment(String name) {
        return name.replace('-', '_').toLowerCase(Locale.ROOT);
    }

    private static String titleCase(String word) {
        StringBuilder sb = new StringBuilder(word.length());
        boolean previousIsLetter = false;
        for (char c : word.toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(previousIsLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousIsLetter = true;
            } else {
                sb.append(c);
                previousIsLetter = false;
            }
        }
        return sb.toString();
    }
}
