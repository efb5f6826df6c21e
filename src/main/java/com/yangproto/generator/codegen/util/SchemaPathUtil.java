package com.yangproto.generator.codegen.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

import com.yangproto.generator.model.Statement;
import com.yangproto.generator.model.YangKeywords;

/**
 * Builds schema paths for statements the way YANG JSON encodes member names:
 * module names instead of prefixes, and a module qualifier only where the owning
 * module changes along the path.
 */
public class SchemaPathUtil {

    /** Statements that do not contribute a path segment. */
    private static final Set<String> TRANSPARENT = Set.of(
            YangKeywords.CHOICE, YangKeywords.CASE, YangKeywords.INPUT, YangKeywords.OUTPUT);

    private SchemaPathUtil() {
        // Utility class
    }

    /**
     * Path with the module qualifier only on change, e.g. {@code /sonic-system:system/hostname}.
     */
    public static String qualifiedPath(Statement stmt) {
        StringBuilder sb = new StringBuilder();
        String lastModule = null;
        for (Statement seg : segments(stmt)) {
            sb.append('/');
            if (!seg.getModuleName().equals(lastModule)) {
                sb.append(seg.getModuleName()).append(':');
            }
            sb.append(seg.getArgument());
            lastModule = seg.getModuleName();
        }
        return sb.length() == 0 ? "/" : sb.toString();
    }

    /**
     * Path where every segment carries its module, used as a lookup key.
     */
    public static String fullyQualifiedPath(Statement stmt) {
        StringBuilder sb = new StringBuilder();
        for (Statement seg : segments(stmt)) {
            sb.append('/').append(seg.getModuleName()).append(':').append(seg.getArgument());
        }
        return sb.length() == 0 ? "/" : sb.toString();
    }

    /**
     * Last segment of {@link #qualifiedPath(Statement)}; this is the JSON member name.
     */
    public static String lastSegment(Statement stmt) {
        String path = qualifiedPath(stmt);
        return path.substring(path.lastIndexOf('/') + 1);
    }

    /**
     * Normalizes a user supplied path so that every segment is module-qualified,
     * inheriting the module of the previous segment where it is omitted.
     */
    public static String normalize(String path) {
        if (path == null || path.isBlank()) {
            return path;
        }
        StringBuilder sb = new StringBuilder();
        String module = null;
        for (String raw : path.split("/")) {
            if (raw.isEmpty()) {
                continue;
            }
            String name = raw;
            int colon = raw.indexOf(':');
            if (colon >= 0) {
                module = raw.substring(0, colon);
                name = raw.substring(colon + 1);
            }
            sb.append('/').append(module).append(':').append(name);
        }
        return sb.toString();
    }

    private static List<Statement> segments(Statement stmt) {
        Deque<Statement> stack = new ArrayDeque<>();
        Statement current = stmt;
        while (current != null && !current.isModule()) {
            if (!TRANSPARENT.contains(current.getKeyword())) {
                stack.push(current);
            }
            current = current.getParent();
        }
        return new ArrayList<>(stack);
    }
}
