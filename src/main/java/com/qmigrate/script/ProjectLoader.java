package com.qmigrate.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.qmigrate.debug.Debug;
import com.qmigrate.script.condition.ConditionMapper;
import com.qmigrate.script.condition.ConditionSimplifier;
import com.qmigrate.script.condition.QtLibraryMapper;
import com.qmigrate.script.parser.Parser;
import com.qmigrate.script.parser.SourceNormalizer;
import com.qmigrate.script.parser.Statement.Stmt;
import com.qmigrate.script.scope.ConditionTotaler;
import com.qmigrate.script.scope.FileSystemPathResolver;
import com.qmigrate.script.scope.Paths;
import com.qmigrate.script.scope.Scope;
import com.qmigrate.script.scope.ScopeBuilder;
import com.qmigrate.script.scope.ScopeDumper;
import com.qmigrate.script.scope.ScopeTree;

/**
 * Runs the whole pipeline for a project file: normalize, parse, build and
 * settle the scopes, pull in include() files, total the conditions, and for
 * subdirs projects load each SUBDIRS entry.
 *
 * Scope paths are relative to the project file's directory.
 */
public final class ProjectLoader {
    private static final String TAG = "qmigrate.parser";
    private static final String TAG_INCLUDE = "qmigrate.include";
    private static final String TAG_SUBDIRS = "qmigrate.subdirs";

    private final QMigrateOptions options;
    private final ConditionMapper conditionMapper;
    private final ConditionSimplifier simplifier;
    private final RootLocator rootLocator;

    public ProjectLoader(QMigrateOptions options) {
        this(options, new ConditionMapper(new QtLibraryMapper()), new ConditionSimplifier(), new QmakeConfRootLocator());
    }

    public ProjectLoader(QMigrateOptions options, ConditionMapper conditionMapper,
                         ConditionSimplifier simplifier, RootLocator rootLocator) {
        if (options == null) throw new IllegalArgumentException("options is null");
        if (conditionMapper == null) throw new IllegalArgumentException("conditionMapper is null");
        if (simplifier == null) throw new IllegalArgumentException("simplifier is null");
        if (rootLocator == null) throw new IllegalArgumentException("rootLocator is null");
        this.options = options;
        this.conditionMapper = conditionMapper;
        this.simplifier = simplifier;
        this.rootLocator = rootLocator;
    }

    /**
     * @throws IOException when the project file cannot be read
     * @throws com.qmigrate.script.parser.ParseError on malformed project text
     * @throws com.qmigrate.script.scope.StructuralError on an orphan else or conflicting values
     */
    public Project load(Path proFile) throws IOException {
        return load(proFile.toAbsolutePath().normalize(), new HashSet<>());
    }

    private Project load(Path file, Set<Path> loading) throws IOException {
        loading.add(file);
        Path workDir = file.getParent();
        String name = file.getFileName().toString();

        FileSystemPathResolver resolver = new FileSystemPathResolver(workDir);
        ScopeTree tree = new ScopeTree(resolver);
        ScopeBuilder builder = new ScopeBuilder(tree, conditionMapper);

        Scope root = builder.build(null, name, parse(file), "", true);
        if (options.debugProStructure()) {
            Debug.get().i(TAG, "Scope structure of " + name + ":\n" + ScopeDumper.structure(root));
        }

        Deque<String> includeStack = new ArrayDeque<>();
        includeStack.push(name);
        processIncludes(root, builder, resolver, includeStack);

        new ConditionTotaler(simplifier).total(root);
        if (options.debugFullProStructure()) {
            Debug.get().i(TAG, "Full scope structure of " + name + ":\n" + ScopeDumper.dump(root));
        }

        List<Subproject> subprojects = new ArrayList<>();
        if (options.resolveSubdirs() && "subdirs".equals(root.template())) {
            collectSubprojects(root, resolver, loading, subprojects);
        }
        return new Project(file, rootLocator.findRoot(file), tree, subprojects);
    }

    private List<Stmt> parse(Path file) throws IOException {
        String source = SourceNormalizer.normalize(Files.readString(file, StandardCharsets.UTF_8));
        if (options.debugParser()) {
            Debug.get().i(TAG, "Normalized " + file + ":\n" + source);
        }
        List<Stmt> statements = new Parser(source).parse();
        if (options.debugParseResult()) {
            StringBuilder sb = new StringBuilder();
            for (Stmt s : statements) sb.append("  ").append(s).append('\n');
            Debug.get().i(TAG, "Parse result of " + file + ":\n" + sb);
        }
        return statements;
    }

    // -------------------------
    // include()
    // -------------------------

    /**
     * Children first, then this scope's _INCLUDED files in order. An included
     * file's scope keeps the including scope's base directory and is merged,
     * not re-parented.
     */
    private void processIncludes(Scope scope, ScopeBuilder builder, FileSystemPathResolver resolver,
                                 Deque<String> includeStack) throws IOException {
        for (Scope child : scope.ownChildren()) {
            processIncludes(child, builder, resolver, includeStack);
        }

        for (String includeFile : scope.files(Scope.INCLUDED_KEY, false, true)) {
            if (includeFile.isEmpty()) continue;
            if (!resolver.isFile(includeFile)) {
                Debug.get().w(TAG_INCLUDE, "Failed to include " + includeFile + ".");
                continue;
            }
            if (includeStack.contains(includeFile)) {
                Debug.get().w(TAG_INCLUDE, "Recursive include of " + includeFile + " ignored.");
                continue;
            }

            Debug.get().d(TAG_INCLUDE, "Including " + includeFile + " into " + scope);
            List<Stmt> statements = parse(resolver.toPath(includeFile));
            Scope included = builder.build(null, includeFile, statements, scope.baseDir(), false);

            includeStack.push(includeFile);
            processIncludes(included, builder, resolver, includeStack);
            includeStack.pop();

            scope.merge(included);
        }
    }

    // -------------------------
    // SUBDIRS
    // -------------------------

    private void collectSubprojects(Scope scope, FileSystemPathResolver resolver, Set<Path> loading,
                                    List<Subproject> out) throws IOException {
        for (String entry : scope.expandKey("SUBDIRS")) {
            Subproject sub = subproject(scope, entry, resolver, loading);
            if (sub != null) out.add(sub);
        }
        for (Scope child : scope.liveChildren()) {
            collectSubprojects(child, resolver, loading, out);
        }
    }

    private Subproject subproject(Scope scope, String entry, FileSystemPathResolver resolver,
                                  Set<Path> loading) throws IOException {
        String condition = scope.totalCondition();
        if (entry.startsWith("-")) {
            return new Subproject(entry.substring(1), condition, true, null);
        }

        String location = entry;
        String subdir = scope.expandString(entry + ".subdir");
        String file = scope.expandString(entry + ".file");
        if (!file.isEmpty()) {
            location = file;
        } else if (!subdir.isEmpty()) {
            location = subdir;
        }

        String path = Paths.trimLeadingDot(Paths.join(scope.currentDir(), location));
        String proFile = null;
        if (resolver.isDirectory(path)) {
            String candidate = path + "/" + Paths.baseName(path) + ".pro";
            if (resolver.isFile(candidate)) proFile = candidate;
        } else if (path.endsWith(".pro") && resolver.isFile(path)) {
            proFile = path;
        }

        if (proFile == null) {
            Debug.get().w(TAG_SUBDIRS, "SUBDIR " + entry + " in " + scope + " not found.");
            return null;
        }

        Path target = resolver.toPath(proFile);
        if (loading.contains(target)) {
            Debug.get().w(TAG_SUBDIRS, "SUBDIR " + entry + " in " + scope + " is already being loaded.");
            return null;
        }
        Debug.get().d(TAG_SUBDIRS, "Loading SUBDIR " + entry + " from " + proFile);
        return new Subproject(entry, condition, false, load(target, loading));
    }
}
