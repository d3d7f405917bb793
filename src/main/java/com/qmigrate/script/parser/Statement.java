package com.qmigrate.script.parser;

import java.util.Collections;
import java.util.List;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);
    }

    public interface StmtVisitor {
        void visitVarOp(VarOp stmt);
        void visitConditional(Conditional stmt);
        void visitInclude(Include stmt);
        void visitLoad(Load stmt);
        void visitOption(Option stmt);
    }

    public static final class VarOp implements Stmt {
        public final String key;
        public final OpKind opKind;
        public final List<String> values;

        public VarOp(String key, OpKind opKind, List<String> values) {
            this.key = key;
            this.opKind = opKind;
            this.values = Collections.unmodifiableList(values);
        }

        public void accept(StmtVisitor visitor) { visitor.visitVarOp(this); }

        @Override
        public String toString() {
            return key + " " + opKind.symbol() + " " + values;
        }
    }

    public static final class Conditional implements Stmt {
        public final String condition;
        public final List<Stmt> body;
        public final List<Stmt> elseBody; // may be null

        public Conditional(String condition, List<Stmt> body, List<Stmt> elseBody) {
            this.condition = condition;
            this.body = Collections.unmodifiableList(body);
            this.elseBody = elseBody == null ? null : Collections.unmodifiableList(elseBody);
        }

        public void accept(StmtVisitor visitor) { visitor.visitConditional(this); }

        Conditional withElse(List<Stmt> elseStatements) {
            return new Conditional(condition, body, elseStatements);
        }

        @Override
        public String toString() {
            return condition + " " + body + (elseBody == null ? "" : " else " + elseBody);
        }
    }

    public static final class Include implements Stmt {
        public final String path;
        public Include(String path) { this.path = path; }
        public void accept(StmtVisitor visitor) { visitor.visitInclude(this); }

        @Override
        public String toString() { return "include(" + path + ")"; }
    }

    public static final class Load implements Stmt {
        public final String name;
        public Load(String name) { this.name = name; }
        public void accept(StmtVisitor visitor) { visitor.visitLoad(this); }

        @Override
        public String toString() { return "load(" + name + ")"; }
    }

    public static final class Option implements Stmt {
        public final String name;
        public Option(String name) { this.name = name; }
        public void accept(StmtVisitor visitor) { visitor.visitOption(this); }

        @Override
        public String toString() { return "option(" + name + ")"; }
    }
}
