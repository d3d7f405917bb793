package com.qmigrate.script;

import java.nio.file.Files;
import java.nio.file.Path;

import com.qmigrate.debug.Debug;

/**
 * The repository root is the nearest ancestor directory holding a ".qmake.conf".
 */
public final class QmakeConfRootLocator implements RootLocator {
    private static final String TAG = "qmigrate.subdirs";

    public static final String MARKER = ".qmake.conf";

    @Override
    public Path findRoot(Path file) {
        if (!file.isAbsolute()) {
            Debug.get().w(TAG, "Could not find " + MARKER + ", given path is not absolute: " + file);
            return null;
        }
        Path dir = file.getParent();
        while (dir != null && Files.isDirectory(dir)) {
            if (Files.isRegularFile(dir.resolve(MARKER))) return dir;
            dir = dir.getParent();
        }
        return null;
    }
}
