package com.qmigrate.script.scope;

import java.nio.file.Path;

/** Posix path helpers; scope directories are kept as '/' separated strings. */
public final class Paths {

    private Paths() {}

    public static String join(String base, String path) {
        if (path.startsWith("/")) return path;
        if (base == null || base.isEmpty()) return path;
        return base.endsWith("/") ? base + path : base + "/" + path;
    }

    public static String trimLeadingDot(String path) {
        String p = path;
        while (p.startsWith("./")) p = p.substring(2);
        return p;
    }

    public static String dirName(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    public static String baseName(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    public static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }

    /** Relative path from base to target, "." when they are the same directory. */
    public static String relative(String base, String target) {
        Path b = Path.of(base.isEmpty() ? "." : base).normalize();
        Path t = Path.of(target.isEmpty() ? "." : target).normalize();
        String rel = toPosix(b.relativize(t));
        return rel.isEmpty() ? "." : rel;
    }

    public static String toPosix(Path path) {
        return path.toString().replace('\\', '/');
    }
}
