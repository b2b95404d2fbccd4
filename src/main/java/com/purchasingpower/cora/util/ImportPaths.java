package com.purchasingpower.cora.util;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Matches module paths written in source (relative imports, package paths, link targets)
 * against repository file paths.
 */
public final class ImportPaths {

    private ImportPaths() {
    }

    /**
     * Resolves a relative module path against the directory of the referencing file. Package
     * style paths ({@code com/acme/Foo}, {@code lodash}) are returned unchanged.
     */
    public static String resolve(String referencingFilePath, String importPath) {
        if (importPath == null) {
            return null;
        }
        if (importPath.startsWith("/")) {
            return normalize(importPath.substring(1));
        }
        if (!importPath.startsWith("./") && !importPath.startsWith("../")) {
            return importPath;
        }
        int slash = referencingFilePath == null ? -1 : referencingFilePath.lastIndexOf('/');
        String directory = slash < 0 ? "" : referencingFilePath.substring(0, slash + 1);
        return normalize(directory + importPath);
    }

    /**
     * True when {@code filePath} is the file {@code modulePath} names: same path ignoring the
     * extension, a path ending in it, or its {@code index} file.
     */
    public static boolean matches(String modulePath, String filePath) {
        if (modulePath == null || modulePath.isEmpty() || filePath == null) {
            return false;
        }
        String module = stripExtension(modulePath);
        String file = stripExtension(filePath);
        return file.equals(module)
                || file.endsWith("/" + module)
                || file.equals(module + "/index")
                || file.endsWith("/" + module + "/index");
    }

    /** Collapses {@code .} and {@code ..} segments and drops empty ones. */
    public static String normalize(String path) {
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (!segments.isEmpty()) {
                    segments.removeLast();
                }
                continue;
            }
            segments.addLast(segment);
        }
        return String.join("/", segments);
    }

    static String stripExtension(String path) {
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        return dot > slash + 1 ? path.substring(0, dot) : path;
    }
}
