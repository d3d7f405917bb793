package com.qmigrate.script.scope;

import java.util.List;

/**
 * File system view used while mapping file lists. Paths are posix style and
 * relative to the project working directory unless absolute.
 */
public interface PathResolver {

    String NOT_FOUND_SUFFIX = "-NOTFOUND";

    boolean isFile(String path);

    boolean isDirectory(String path);

    /**
     * Locates source relative to baseDir, falling back to each search path in
     * order. Returns source + NOT_FOUND_SUFFIX when nothing matches.
     */
    String resolve(String source, String baseDir, List<String> searchPaths);
}
