package com.qmigrate.script.scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.qmigrate.script.condition.ConditionSimplifier;

/**
 * A node of the scope tree: a guard condition plus the ordered variable
 * operations declared under it.
 *
 * Scopes are mutated while the tree is built, settled and totaled; after that
 * every query below is read-only apart from the visited-key bookkeeping.
 */
public final class Scope {

    static final int NONE = -1;

    public static final String INCLUDED_KEY = "_INCLUDED";
    public static final String LOADED_KEY = "_LOADED";
    public static final String OPTION_KEY = "_OPTION";

    static final String PRO_FILE_PWD = "_PRO_FILE_PWD_";
    static final String SOURCE_DIR = "${CMAKE_CURRENT_SOURCE_DIR}";
    static final String BINARY_DIR = "${CMAKE_CURRENT_BINARY_DIR}";

    private final ScopeTree tree;
    private final int id;
    private final String file;
    private final String currentDir;
    private final String baseDir;

    private int parentId = NONE;
    private String condition;
    private String totalCondition;
    private boolean detached;

    private final Map<String, List<Operation>> operations = new LinkedHashMap<>();
    private List<Integer> childIds = new ArrayList<>();
    private final List<Integer> includedIds = new ArrayList<>();
    private final Set<String> visitedKeys = new LinkedHashSet<>();

    Scope(ScopeTree tree, int id, String file, String condition, String baseDir) {
        this.tree = tree;
        this.id = id;
        this.file = file == null ? "" : file;
        String dir = Paths.dirName(this.file);
        this.currentDir = dir.isEmpty() ? "." : dir;
        this.baseDir = baseDir == null || baseDir.isEmpty() ? currentDir : baseDir;
        this.condition = condition == null ? "" : condition;
    }

    // -------------------------
    // Structure
    // -------------------------

    public int id() { return id; }
    public String file() { return file; }
    public String baseDir() { return baseDir; }
    public String currentDir() { return currentDir; }
    public String condition() { return condition; }
    public ScopeTree tree() { return tree; }

    public Scope parent() {
        return parentId == NONE ? null : tree.get(parentId);
    }

    boolean isDetached() { return detached; }

    void detach() {
        detached = true;
        childIds = new ArrayList<>();
    }

    void setCondition(String condition) {
        this.condition = condition;
    }

    void addChild(Scope child) {
        child.parentId = id;
        childIds.add(child.id);
    }

    void replaceChildren(List<Scope> children) {
        List<Integer> ids = new ArrayList<>();
        for (Scope c : children) {
            c.parentId = id;
            ids.add(c.id);
        }
        childIds = ids;
    }

    /** Children declared in this scope's own file. */
    public List<Scope> ownChildren() {
        List<Scope> out = new ArrayList<>();
        for (int childId : childIds) out.add(tree.get(childId));
        return out;
    }

    /** Own children followed by the children of every included scope, in inclusion order. */
    public List<Scope> children() {
        List<Scope> out = ownChildren();
        for (Scope included : includedScopes()) {
            out.addAll(included.children());
        }
        return out;
    }

    /** Children whose total condition is not the always-false sentinel. */
    public List<Scope> liveChildren() {
        List<Scope> out = new ArrayList<>();
        for (Scope c : children()) {
            if (!c.isDead()) out.add(c);
        }
        return out;
    }

    public List<Scope> includedScopes() {
        List<Scope> out = new ArrayList<>();
        for (int includedId : includedIds) out.add(tree.get(includedId));
        return out;
    }

    /** Registers an included file's scope; it is resolved after this scope's own operations. */
    public void merge(Scope other) {
        if (other == this) throw new IllegalArgumentException("A scope cannot include itself");
        includedIds.add(other.id);
    }

    // -------------------------
    // Conditions
    // -------------------------

    /** Cached total condition, or null before condition totaling ran. */
    public String totalCondition() {
        return totalCondition;
    }

    void cacheTotalCondition(String total) {
        if (totalCondition != null) {
            throw new IllegalStateException("Total condition already computed for scope " + this);
        }
        totalCondition = total;
    }

    public boolean isDead() {
        return ConditionSimplifier.FALSE.equals(totalCondition);
    }

    // -------------------------
    // Operations
    // -------------------------

    public void appendOperation(String key, Operation op) {
        operations.computeIfAbsent(key, k -> new ArrayList<>()).add(op);
    }

    public boolean hasOperations() {
        return !operations.isEmpty();
    }

    public List<Operation> operations(String key) {
        List<Operation> ops = operations.get(key);
        return ops == null ? Collections.emptyList() : Collections.unmodifiableList(ops);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(operations.keySet());
    }

    public Set<String> visitedKeys() {
        return Collections.unmodifiableSet(visitedKeys);
    }

    /** Keys with operations that no query has read yet, sorted. */
    public Set<String> unvisitedKeys() {
        Set<String> out = new TreeSet<>(operations.keySet());
        out.removeAll(visitedKeys);
        return out;
    }

    public void resetVisitedKeys() {
        visitedKeys.clear();
    }

    // -------------------------
    // Resolution
    // -------------------------

    public List<String> resolve(String key) {
        return resolve(key, false);
    }

    /**
     * Folds the operation chain for key. With inherit, the parent's resolved value
     * seeds the fold. Included scopes contribute after this scope's own operations.
     */
    public List<String> resolve(String key, boolean inherit) {
        List<String> builtin = builtin(key);
        if (builtin != null) return builtin;
        return evalOps(key, null, new ArrayList<>(), inherit);
    }

    private List<String> builtin(String key) {
        boolean samePath = currentDir.equals(baseDir);
        switch (key) {
            case PRO_FILE_PWD:
                return List.of(SOURCE_DIR);
            case "PWD":
                return List.of(samePath ? SOURCE_DIR : SOURCE_DIR + "/" + Paths.relative(baseDir, currentDir));
            case "OUT_PWD":
                return List.of(samePath ? BINARY_DIR : BINARY_DIR + "/" + Paths.relative(baseDir, currentDir));
            default:
                return null;
        }
    }

    /** The scope-aware transformer: applied per scope so that paths use that scope's directories. */
    interface ScopeTransformer {
        List<String> apply(Scope scope, List<String> values);
    }

    List<String> evalOps(String key, ScopeTransformer transformer, List<String> seed, boolean inherit) {
        visitedKeys.add(key);

        List<String> result = seed;
        Scope parent = parent();
        if (parent != null && inherit) {
            result = parent.evalOps(key, transformer, result, true);
        }

        Operation.Transformer opTransformer = transformer == null
                ? Operation.IDENTITY
                : values -> transformer.apply(this, values);

        for (Operation op : operations(key)) {
            result = op.process(key, result, opTransformer);
        }

        for (Scope included : includedScopes()) {
            result = included.evalOps(key, transformer, result, false);
        }
        return result;
    }

    /**
     * Single value of a key; more than one value is a conflicting declaration.
     */
    public String getString(String key, String defaultValue, boolean inherit) {
        List<String> values = resolve(key, inherit);
        if (values.isEmpty()) return defaultValue;
        if (values.size() > 1) {
            throw new StructuralError(file, "Conflicting values " + values + " for single-valued key " + key);
        }
        return values.get(0);
    }

    public String getString(String key) {
        return getString(key, "", false);
    }

    // -------------------------
    // Expansion and files
    // -------------------------

    /** Substitutes $$name tokens in text; see {@link ValueExpander}. */
    public List<String> expand(String text) {
        return new ValueExpander(this).expand(text);
    }

    /** Resolves key and expands every value. */
    public List<String> expandKey(String key) {
        List<String> out = new ArrayList<>();
        for (String value : resolve(key)) {
            out.addAll(expand(value));
        }
        return out;
    }

    public String expandString(String key) {
        List<String> out = expand(getString(key));
        if (out.size() > 1) {
            throw new StructuralError(file, "Key " + key + " expands to several values " + out);
        }
        return out.isEmpty() ? "" : out.get(0);
    }

    public List<String> files(String key) {
        return files(key, false, false);
    }

    /**
     * Resolves key with every operand expanded and mapped onto this scope's
     * directory (the current directory for includes, the base directory
     * otherwise), optionally located through the inherited VPATH.
     */
    public List<String> files(String key, boolean useVpath, boolean isInclude) {
        ScopeTransformer transformer = (scope, values) -> scope.mapFiles(values, useVpath, isInclude);
        return evalOps(key, transformer, new ArrayList<>(), false);
    }

    List<String> mapFiles(List<String> values, boolean useVpath, boolean isInclude) {
        List<String> vpath = null;
        if (useVpath) {
            vpath = new ArrayList<>();
            for (String v : resolve("VPATH", true)) vpath.addAll(expand(v));
        }

        List<String> out = new ArrayList<>();
        for (String value : values) {
            for (String expanded : expand(value)) {
                String mapped = mapToFile(expanded, isInclude);
                if (useVpath) {
                    mapped = tree.pathResolver().resolve(mapped, baseDir, vpath);
                }
                if (mapped.startsWith(SOURCE_DIR + "/")) {
                    mapped = mapped.substring(SOURCE_DIR.length() + 1);
                }
                out.add(Paths.trimLeadingDot(mapped));
            }
        }
        return out;
    }

    private String mapToFile(String f, boolean isInclude) {
        if (f.startsWith("${")) return f;
        return Paths.trimLeadingDot(Paths.join(isInclude ? currentDir : baseDir, f));
    }

    // -------------------------
    // Derived values
    // -------------------------

    public String template() {
        return getString("TEMPLATE", "app", false);
    }

    /** Expanded TARGET, or the file's base name; "../" segments are dropped. */
    public String target() {
        String target = expandString("TARGET");
        if (target.isEmpty()) {
            target = Paths.stripExtension(Paths.baseName(file));
        }
        return target.replace("../", "");
    }

    public boolean isScopeDebug() {
        String flag = getString("QMIGRATE_SCOPE_DEBUG", "", false).toLowerCase();
        return flag.equals("1") || flag.equals("on") || flag.equals("yes") || flag.equals("true");
    }

    @Override
    public String toString() {
        return id + ":" + baseDir + ":" + currentDir + ":" + file + ":" + (condition.isEmpty() ? "<TRUE>" : condition);
    }
}
