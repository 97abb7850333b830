package com.pascalite.compiler.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        <R> R accept(StmtVisitor<R> visitor);
    }

    public interface StmtVisitor<R> {
        R visitCompoundStmt(Compound stmt);
        R visitAssignStmt(Assign stmt);
        R visitIfStmt(If stmt);
        R visitWhileStmt(While stmt);
        R visitRepeatStmt(Repeat stmt);
        R visitForStmt(For stmt);
        R visitCallStmt(Call stmt);
        R visitEmptyStmt(Empty stmt);
    }

    /** begin ... end */
    public static final class Compound implements Stmt {
        public final Token begin;
        public final List<Stmt> statements;

        public Compound(Token begin, List<Stmt> statements) {
            this.begin = begin;
            this.statements = List.copyOf(statements);
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitCompoundStmt(this); }
    }

    public static final class Assign implements Stmt {
        public final Expr.Variable target;
        public final Token operator;
        public final Expr.ExprInterface value;

        public Assign(Expr.Variable target, Token operator, Expr.ExprInterface value) {
            this.target = target;
            this.operator = operator;
            this.value = value;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitAssignStmt(this); }
    }

    public static final class If implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface condition;
        public final Stmt thenBranch;
        public final Stmt elseBranch; // may be null

        public If(Token keyword, Expr.ExprInterface condition, Stmt thenBranch, Stmt elseBranch) {
            this.keyword = keyword;
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIfStmt(this); }
    }

    public static final class While implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface condition;
        public final Stmt body;

        public While(Token keyword, Expr.ExprInterface condition, Stmt body) {
            this.keyword = keyword;
            this.condition = condition;
            this.body = body;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitWhileStmt(this); }
    }

    public static final class Repeat implements Stmt {
        public final Token keyword;
        public final List<Stmt> body;
        public final Expr.ExprInterface condition;

        public Repeat(Token keyword, List<Stmt> body, Expr.ExprInterface condition) {
            this.keyword = keyword;
            this.body = List.copyOf(body);
            this.condition = condition;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitRepeatStmt(this); }
    }

    public static final class For implements Stmt {
        public final Token keyword;
        public final Expr.Variable variable;
        public final Expr.ExprInterface from;
        public final boolean downTo;
        public final Expr.ExprInterface to;
        public final Stmt body;

        public For(Token keyword, Expr.Variable variable, Expr.ExprInterface from, boolean downTo,
                   Expr.ExprInterface to, Stmt body) {
            this.keyword = keyword;
            this.variable = variable;
            this.from = from;
            this.downTo = downTo;
            this.to = to;
            this.body = body;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitForStmt(this); }
    }

    /** Procedure call, including the write/writeln/readln builtins. */
    public static final class Call implements Stmt {
        public final Token name;
        public final List<Expr.ExprInterface> arguments;

        public Call(Token name, List<Expr.ExprInterface> arguments) {
            this.name = name;
            this.arguments = List.copyOf(arguments);
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitCallStmt(this); }
    }

    public static final class Empty implements Stmt {
        public final SourcePosition position;

        public Empty(SourcePosition position) {
            this.position = position;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitEmptyStmt(this); }
    }
}
