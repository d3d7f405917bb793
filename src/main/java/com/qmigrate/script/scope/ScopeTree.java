package com.qmigrate.script.scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Arena owning every scope built for one primary project file, including the
 * scopes of its included files. Scopes refer to each other by arena id; the id
 * is the insertion index.
 */
public final class ScopeTree {

    private final List<Scope> scopes = new ArrayList<>();
    private final PathResolver pathResolver;

    public ScopeTree(PathResolver pathResolver) {
        if (pathResolver == null) throw new IllegalArgumentException("pathResolver is null");
        this.pathResolver = pathResolver;
    }

    /**
     * Creates a scope. A scope with a parent is appended to the parent's children;
     * baseDir defaults to the directory of file.
     */
    public Scope create(Scope parent, String file, String condition, String baseDir) {
        Scope scope = new Scope(this, scopes.size(), file, condition, baseDir);
        scopes.add(scope);
        if (parent != null) {
            parent.addChild(scope);
        }
        return scope;
    }

    public Scope get(int id) {
        if (id < 0 || id >= scopes.size()) {
            throw new IllegalArgumentException("No scope with id " + id);
        }
        return scopes.get(id);
    }

    /** The primary file's scope. */
    public Scope root() {
        if (scopes.isEmpty()) throw new IllegalStateException("Scope tree is empty");
        return scopes.get(0);
    }

    public int size() {
        return scopes.size();
    }

    /** Every scope still attached to a tree, in creation order. */
    public List<Scope> all() {
        List<Scope> out = new ArrayList<>();
        for (Scope s : scopes) {
            if (!s.isDetached()) out.add(s);
        }
        return Collections.unmodifiableList(out);
    }

    public PathResolver pathResolver() {
        return pathResolver;
    }
}
