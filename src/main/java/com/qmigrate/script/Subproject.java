package com.qmigrate.script;

/**
 * One SUBDIRS entry of a subdirs project: the directory or .pro file it names,
 * the total condition of the scope declaring it, and the loaded project.
 */
public final class Subproject {

    private final String name;
    private final String condition;
    private final boolean removal;
    private final Project project;

    Subproject(String name, String condition, boolean removal, Project project) {
        this.name = name;
        this.condition = condition;
        this.removal = removal;
        this.project = project;
    }

    /** The SUBDIRS value without a leading "-". */
    public String name() { return name; }

    public String condition() { return condition; }

    /** True for "-name" entries, which take a previously added subdirectory away. */
    public boolean isRemoval() { return removal; }

    /** The loaded project; null for removals. */
    public Project project() { return project; }

    @Override
    public String toString() {
        return (removal ? "-" : "") + name + " [" + condition + "]";
    }
}
