package com.pascalite.compiler.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.pascalite.compiler.parser.Declaration;
import com.pascalite.compiler.parser.Declaration.ItemVisitor;
import com.pascalite.compiler.parser.Expr;
import com.pascalite.compiler.parser.Expr.ExprInterface;
import com.pascalite.compiler.parser.Expr.ExprVisitor;
import com.pascalite.compiler.parser.Statement;
import com.pascalite.compiler.parser.Statement.Stmt;
import com.pascalite.compiler.parser.Statement.StmtVisitor;
import com.pascalite.compiler.parser.Token;

/** Maps a syntax tree onto {@link DisplayNode}s. Never mutates the tree. */
final class TreeLabeler implements ExprVisitor<DisplayNode>, StmtVisitor<DisplayNode>, ItemVisitor<DisplayNode> {

    DisplayNode program(Declaration.Program program) {
        return node("Program", program.displayName(), block(program.block));
    }

    private DisplayNode block(Declaration.Block block) {
        List<DisplayNode> children = new ArrayList<>();
        for (Declaration.Item item : block.declarations) children.add(item.accept(this));
        children.add(block.body.accept(this));
        return new DisplayNode("Block", null, children);
    }

    @Override
    public DisplayNode visitConstant(Declaration.Constant constant) {
        return node("ConstantDefinition", constant.name.lexeme, constant.value.accept(this));
    }

    @Override
    public DisplayNode visitVariables(Declaration.Variables variables) {
        String names = variables.names.stream().map(t -> t.lexeme).collect(Collectors.joining(", "));
        return node("VariableDeclaration", names + " : " + variables.type.keyword());
    }

    @Override
    public DisplayNode visitProcedure(Declaration.Procedure procedure) {
        return node("ProcedureDeclaration", procedure.name.lexeme, block(procedure.block));
    }

    @Override
    public DisplayNode visitCompoundStmt(Statement.Compound stmt) {
        return new DisplayNode("CompoundStatement", null, statements(stmt.statements));
    }

    @Override
    public DisplayNode visitAssignStmt(Statement.Assign stmt) {
        return node("Assignment", null, stmt.target.accept(this), stmt.value.accept(this));
    }

    @Override
    public DisplayNode visitIfStmt(Statement.If stmt) {
        if (stmt.elseBranch == null) {
            return node("IfStatement", null, stmt.condition.accept(this), stmt.thenBranch.accept(this));
        }
        return node("IfStatement", null,
                stmt.condition.accept(this), stmt.thenBranch.accept(this), stmt.elseBranch.accept(this));
    }

    @Override
    public DisplayNode visitWhileStmt(Statement.While stmt) {
        return node("WhileStatement", null, stmt.condition.accept(this), stmt.body.accept(this));
    }

    @Override
    public DisplayNode visitRepeatStmt(Statement.Repeat stmt) {
        List<DisplayNode> children = statements(stmt.body);
        children.add(stmt.condition.accept(this));
        return new DisplayNode("RepeatStatement", null, children);
    }

    @Override
    public DisplayNode visitForStmt(Statement.For stmt) {
        return node("ForStatement", stmt.downTo ? "downto" : "to",
                stmt.variable.accept(this), stmt.from.accept(this), stmt.to.accept(this), stmt.body.accept(this));
    }

    @Override
    public DisplayNode visitCallStmt(Statement.Call stmt) {
        List<DisplayNode> children = new ArrayList<>();
        for (ExprInterface arg : stmt.arguments) children.add(arg.accept(this));
        return new DisplayNode("ProcedureCall", stmt.name.lexeme, children);
    }

    @Override
    public DisplayNode visitEmptyStmt(Statement.Empty stmt) {
        return node("EmptyStatement", null);
    }

    @Override
    public DisplayNode visitBinaryExpr(Expr.Binary expr) {
        return node("BinaryExpression", operator(expr.operator), expr.left.accept(this), expr.right.accept(this));
    }

    @Override
    public DisplayNode visitUnaryExpr(Expr.Unary expr) {
        return node("UnaryExpression", operator(expr.operator), expr.operand.accept(this));
    }

    @Override
    public DisplayNode visitIntegerLiteralExpr(Expr.IntegerLiteral expr) {
        return node("IntegerLiteral", Integer.toString(expr.value));
    }

    @Override
    public DisplayNode visitRealLiteralExpr(Expr.RealLiteral expr) {
        return node("RealLiteral", Double.toString(expr.value));
    }

    @Override
    public DisplayNode visitStringLiteralExpr(Expr.StringLiteral expr) {
        return node("StringLiteral", "'" + expr.value.replace("'", "''") + "'");
    }

    @Override
    public DisplayNode visitBooleanLiteralExpr(Expr.BooleanLiteral expr) {
        return node("BooleanLiteral", Boolean.toString(expr.value));
    }

    @Override
    public DisplayNode visitVariableExpr(Expr.Variable expr) {
        return node("Variable", expr.name.lexeme);
    }

    private List<DisplayNode> statements(List<Stmt> statements) {
        List<DisplayNode> out = new ArrayList<>();
        for (Stmt s : statements) out.add(s.accept(this));
        return out;
    }

    // keywords print lower case whatever the source spelling
    private static String operator(Token op) {
        return (op.type.spelling != null) ? op.type.spelling : op.lexeme;
    }

    private static DisplayNode node(String name, String value, DisplayNode... children) {
        return new DisplayNode(name, value, List.of(children));
    }
}
