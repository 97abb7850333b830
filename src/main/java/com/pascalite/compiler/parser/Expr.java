package com.pascalite.compiler.parser;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);

        /** Position of the token that begins or names this expression. */
        SourcePosition position();
    }

    public interface ExprVisitor<R> {
        R visitBinaryExpr(Binary expr);
        R visitUnaryExpr(Unary expr);
        R visitIntegerLiteralExpr(IntegerLiteral expr);
        R visitRealLiteralExpr(RealLiteral expr);
        R visitStringLiteralExpr(StringLiteral expr);
        R visitBooleanLiteralExpr(BooleanLiteral expr);
        R visitVariableExpr(Variable expr);
    }

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }

        @Override
        public SourcePosition position() {
            return operator.position;
        }
    }

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface operand;

        public Unary(Token operator, ExprInterface operand) {
            this.operator = operator;
            this.operand = operand;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }

        @Override
        public SourcePosition position() {
            return operator.position;
        }
    }

    public static final class IntegerLiteral implements ExprInterface {
        public final Token token;
        public final int value;

        public IntegerLiteral(Token token) {
            this.token = token;
            this.value = (Integer) token.literal;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIntegerLiteralExpr(this);
        }

        @Override
        public SourcePosition position() {
            return token.position;
        }
    }

    public static final class RealLiteral implements ExprInterface {
        public final Token token;
        public final double value;

        public RealLiteral(Token token) {
            this.token = token;
            this.value = (Double) token.literal;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitRealLiteralExpr(this);
        }

        @Override
        public SourcePosition position() {
            return token.position;
        }
    }

    public static final class StringLiteral implements ExprInterface {
        public final Token token;
        public final String value;

        public StringLiteral(Token token) {
            this.token = token;
            this.value = (String) token.literal;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitStringLiteralExpr(this);
        }

        @Override
        public SourcePosition position() {
            return token.position;
        }
    }

    public static final class BooleanLiteral implements ExprInterface {
        public final Token token;
        public final boolean value;

        public BooleanLiteral(Token token) {
            this.token = token;
            this.value = token.type == TokenType.TRUE;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBooleanLiteralExpr(this);
        }

        @Override
        public SourcePosition position() {
            return token.position;
        }
    }

    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }

        @Override
        public SourcePosition position() {
            return name.position;
        }
    }
}
