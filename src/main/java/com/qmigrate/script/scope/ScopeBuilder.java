package com.qmigrate.script.scope;

import java.util.List;

import com.qmigrate.debug.Debug;
import com.qmigrate.script.condition.ConditionMapper;
import com.qmigrate.script.parser.OpKind;
import com.qmigrate.script.parser.Statement.Conditional;
import com.qmigrate.script.parser.Statement.Include;
import com.qmigrate.script.parser.Statement.Load;
import com.qmigrate.script.parser.Statement.Option;
import com.qmigrate.script.parser.Statement.Stmt;
import com.qmigrate.script.parser.Statement.StmtVisitor;
import com.qmigrate.script.parser.Statement.VarOp;

/**
 * Folds a parsed statement list into scopes of a {@link ScopeTree}, then
 * settles the new file scope.
 */
public final class ScopeBuilder {
    private static final String TAG = "qmigrate.scope";

    private final ScopeTree tree;
    private final ConditionMapper conditionMapper;

    public ScopeBuilder(ScopeTree tree, ConditionMapper conditionMapper) {
        this.tree = tree;
        this.conditionMapper = conditionMapper;
    }

    /**
     * Builds the scope of one file.
     *
     * @param parent  owning scope for subprojects, null for primary and included files
     * @param primary seeds the top-level defaults (QT = core gui)
     */
    public Scope build(Scope parent, String file, List<Stmt> statements, String baseDir, boolean primary) {
        Scope scope = tree.create(parent, file, "", baseDir);
        seedDefaults(scope, primary);
        fold(scope, statements);

        ScopeSettler.settle(scope);

        if (scope.isScopeDebug()) {
            Debug.get().d(TAG, () -> "Created scope " + scope + ":\n" + ScopeDumper.dump(scope, 1));
            scope.resetVisitedKeys();
        }
        return scope;
    }

    private static void seedDefaults(Scope scope, boolean primary) {
        scope.appendOperation("QT_SOURCE_TREE", Operation.of(OpKind.SET, List.of("${QT_SOURCE_TREE}")));
        scope.appendOperation("QT_BUILD_TREE", Operation.of(OpKind.SET, List.of("${PROJECT_BUILD_DIR}")));
        if (primary) {
            scope.appendOperation("QT", Operation.of(OpKind.SET, List.of("core", "gui")));
        }
    }

    private void fold(Scope scope, List<Stmt> statements) {
        Folder folder = new Folder(scope);
        for (Stmt stmt : statements) {
            stmt.accept(folder);
        }
    }

    private Scope child(Scope parent, String condition, List<Stmt> statements) {
        String mapped = "else".equals(condition) ? condition : conditionMapper.map(condition);
        Scope child = tree.create(parent, parent.file(), mapped, parent.baseDir());
        fold(child, statements);
        return child;
    }

    private final class Folder implements StmtVisitor {
        private final Scope scope;

        Folder(Scope scope) {
            this.scope = scope;
        }

        @Override
        public void visitVarOp(VarOp stmt) {
            scope.appendOperation(stmt.key, Operation.of(stmt.opKind, stmt.values));
        }

        @Override
        public void visitConditional(Conditional stmt) {
            child(scope, stmt.condition, stmt.body);
            if (stmt.elseBody != null) {
                child(scope, "else", stmt.elseBody);
            }
        }

        @Override
        public void visitInclude(Include stmt) {
            scope.appendOperation(Scope.INCLUDED_KEY, Operation.of(OpKind.UNIQUE_ADD, List.of(stmt.path)));
        }

        @Override
        public void visitLoad(Load stmt) {
            scope.appendOperation(Scope.LOADED_KEY, Operation.of(OpKind.UNIQUE_ADD, List.of(stmt.name)));
        }

        @Override
        public void visitOption(Option stmt) {
            scope.appendOperation(Scope.OPTION_KEY, Operation.of(OpKind.UNIQUE_ADD, List.of(stmt.name)));
        }
    }
}
