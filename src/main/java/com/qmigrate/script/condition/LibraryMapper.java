package com.qmigrate.script.condition;

/**
 * Maps qmake library names onto CMake target names.
 */
public interface LibraryMapper {

    /** "gui" to "Qt::Gui", "core-private" to "Qt::CorePrivate". */
    String mapQtLibrary(String name);

    /** Whether name is a third-party library with a known CMake package. */
    boolean isKnownThirdParty(String name);

    /** Third-party CMake target for name, or name itself when unknown. */
    String mapLibrary(String name);
}
