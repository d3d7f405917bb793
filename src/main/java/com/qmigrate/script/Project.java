package com.qmigrate.script;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.qmigrate.script.scope.Paths;
import com.qmigrate.script.scope.Scope;
import com.qmigrate.script.scope.ScopeTree;

/**
 * A loaded project file: its settled, totaled scope tree plus any subprojects.
 */
public final class Project {

    private final Path file;
    private final Path repositoryRoot;
    private final ScopeTree tree;
    private final List<Subproject> subprojects;

    Project(Path file, Path repositoryRoot, ScopeTree tree, List<Subproject> subprojects) {
        this.file = file;
        this.repositoryRoot = repositoryRoot;
        this.tree = tree;
        this.subprojects = Collections.unmodifiableList(new ArrayList<>(subprojects));
    }

    public Path file() { return file; }

    /** Directory holding the nearest .qmake.conf, or null. */
    public Path repositoryRoot() { return repositoryRoot; }

    public ScopeTree tree() { return tree; }

    public Scope root() { return tree.root(); }

    public List<Subproject> subprojects() { return subprojects; }

    /** Every attached scope whose total condition is not always false. */
    public List<Scope> liveScopes() {
        List<Scope> out = new ArrayList<>();
        for (Scope s : tree.all()) {
            if (!s.isDead()) out.add(s);
        }
        return out;
    }

    /** Example projects live under "examples" in the repository and are not bundled 3rdparty code. */
    public boolean isExample() {
        if (repositoryRoot == null) return false;
        String relative = Paths.toPosix(repositoryRoot.relativize(file));
        return relative.startsWith("examples") && !relative.contains("3rdparty");
    }

    @Override
    public String toString() {
        return "Project(" + file + ")";
    }
}
