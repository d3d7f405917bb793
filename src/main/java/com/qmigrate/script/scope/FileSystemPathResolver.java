package com.qmigrate.script.scope;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.qmigrate.debug.Debug;

public final class FileSystemPathResolver implements PathResolver {
    private static final String TAG = "qmigrate.vpath";

    private final Path workDir;

    public FileSystemPathResolver(Path workDir) {
        if (workDir == null) throw new IllegalArgumentException("workDir is null");
        this.workDir = workDir.toAbsolutePath().normalize();
    }

    public Path workDir() {
        return workDir;
    }

    public Path toPath(String path) {
        return workDir.resolve(path).normalize();
    }

    @Override
    public boolean isFile(String path) {
        return path != null && !path.isEmpty() && Files.isRegularFile(toPath(path));
    }

    @Override
    public boolean isDirectory(String path) {
        return path != null && !path.isEmpty() && Files.isDirectory(toPath(path));
    }

    @Override
    public String resolve(String source, String baseDir, List<String> searchPaths) {
        if (source == null || source.isEmpty()) return "";
        if (searchPaths == null || searchPaths.isEmpty()) return source;
        if (Files.exists(toPath(source))) return source;

        // a variable based path, not validated
        if (source.startsWith("${")) return source;

        Path base = toPath(baseDir == null || baseDir.isEmpty() ? "." : baseDir);
        for (String searchPath : searchPaths) {
            Path candidate = toPath(searchPath).resolve(source).normalize();
            if (Files.exists(candidate)) {
                return Paths.trimLeadingDot(Paths.toPosix(base.relativize(candidate)));
            }
        }

        Debug.get().w(TAG, "Source " + source + ": Not found.");
        return source + NOT_FOUND_SUFFIX;
    }
}
