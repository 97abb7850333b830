package com.pascalite.compiler.codegen;

import com.pascalite.compiler.parser.DataType;
import com.pascalite.compiler.parser.Expr;
import com.pascalite.compiler.parser.Token;

/** Computes the static type of an expression against the current scopes. */
final class ExpressionTyper implements Expr.ExprVisitor<DataType> {

    private final SymbolTable symbols;

    ExpressionTyper(SymbolTable symbols) {
        this.symbols = symbols;
    }

    DataType typeOf(Expr.ExprInterface expr) {
        return expr.accept(this);
    }

    @Override
    public DataType visitBinaryExpr(Expr.Binary expr) {
        DataType left = typeOf(expr.left);
        DataType right = typeOf(expr.right);
        switch (expr.operator.type) {
            case PLUS:
                if (left == DataType.STRING && right == DataType.STRING) return DataType.STRING;
                return arithmetic(expr.operator, left, right);
            case MINUS:
            case STAR:
                return arithmetic(expr.operator, left, right);
            case SLASH:
                if (left.isNumeric() && right.isNumeric()) return DataType.REAL;
                throw mismatch(expr.operator, left, right);
            case DIV:
            case MOD:
                if (left == DataType.INTEGER && right == DataType.INTEGER) return DataType.INTEGER;
                throw mismatch(expr.operator, left, right);
            case AND:
            case OR:
                if (left == DataType.BOOLEAN && right == DataType.BOOLEAN) return DataType.BOOLEAN;
                throw mismatch(expr.operator, left, right);
            case EQUAL:
            case NOT_EQUAL:
                if ((left.isNumeric() && right.isNumeric()) || left == right) return DataType.BOOLEAN;
                throw mismatch(expr.operator, left, right);
            case LESS:
            case LESS_EQUAL:
            case GREATER:
            case GREATER_EQUAL:
                if (left.isNumeric() && right.isNumeric()) return DataType.BOOLEAN;
                throw mismatch(expr.operator, left, right);
            default:
                throw new IllegalStateException("not a binary operator: " + expr.operator);
        }
    }

    @Override
    public DataType visitUnaryExpr(Expr.Unary expr) {
        DataType operand = typeOf(expr.operand);
        switch (expr.operator.type) {
            case NOT:
                if (operand == DataType.BOOLEAN) return operand;
                break;
            case PLUS:
            case MINUS:
                if (operand.isNumeric()) return operand;
                break;
            default:
                throw new IllegalStateException("not a unary operator: " + expr.operator);
        }
        throw new SemanticException(expr.position(), "Type mismatch: cannot apply '"
                + expr.operator.type.spelling + "' to " + operand.keyword());
    }

    @Override
    public DataType visitIntegerLiteralExpr(Expr.IntegerLiteral expr) {
        return DataType.INTEGER;
    }

    @Override
    public DataType visitRealLiteralExpr(Expr.RealLiteral expr) {
        return DataType.REAL;
    }

    @Override
    public DataType visitStringLiteralExpr(Expr.StringLiteral expr) {
        return DataType.STRING;
    }

    @Override
    public DataType visitBooleanLiteralExpr(Expr.BooleanLiteral expr) {
        return DataType.BOOLEAN;
    }

    @Override
    public DataType visitVariableExpr(Expr.Variable expr) {
        Symbol s = symbols.resolve(expr.name.lexeme, expr.position());
        if (s.kind == Symbol.Kind.PROCEDURE) {
            throw new SemanticException(expr.position(), "Procedure '" + s.name + "' used as a value");
        }
        return s.type;
    }

    private static DataType arithmetic(Token op, DataType left, DataType right) {
        if (!left.isNumeric() || !right.isNumeric()) throw mismatch(op, left, right);
        return (left == DataType.REAL || right == DataType.REAL) ? DataType.REAL : DataType.INTEGER;
    }

    private static SemanticException mismatch(Token op, DataType left, DataType right) {
        return new SemanticException(op.position, "Type mismatch: cannot apply '" + op.type.spelling
                + "' to " + left.keyword() + " and " + right.keyword());
    }
}
