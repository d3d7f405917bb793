package com.qmigrate.script;

import java.nio.file.Path;

/** Finds the repository root a project file belongs to. */
@FunctionalInterface
public interface RootLocator {

    /** Root directory for file, or null when there is none. */
    Path findRoot(Path file);
}
