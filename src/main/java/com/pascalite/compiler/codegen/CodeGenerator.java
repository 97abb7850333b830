package com.pascalite.compiler.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.pascalite.compiler.parser.DataType;
import com.pascalite.compiler.parser.Declaration;
import com.pascalite.compiler.parser.Expr;
import com.pascalite.compiler.parser.Statement;
import com.pascalite.compiler.parser.Token;
import com.pascalite.compiler.parser.TokenType;
import com.pascalite.compiler.vm.Opcode;
import com.pascalite.compiler.vm.Slot;
import com.pascalite.compiler.vm.VmProgram;
import com.pascalite.debug.Debug;

/**
 * Translates a checked syntax tree into a {@link VmProgram}.
 *
 * Layout of every block: an optional {@code JUMP} over the bodies of the
 * procedures it declares (each ending in {@code RETURN}), then its own
 * statements. The main block is wrapped in {@code START} / {@code STOP}.
 * Every variable of every scope gets its own slot.
 *
 * Each call to {@link #generate} works on a fresh symbol table and buffer, so
 * one generator can be reused.
 */
public final class CodeGenerator {
    private static final String TAG = "pascalite.codegen";

    private final boolean checkDivisionByZero;

    public CodeGenerator() {
        this(true);
    }

    /** @param checkDivisionByZero reject {@code /}, {@code div} and {@code mod} by a literal or constant zero */
    public CodeGenerator(boolean checkDivisionByZero) {
        this.checkDivisionByZero = checkDivisionByZero;
    }

    public VmProgram generate(Declaration.Program program) {
        VmProgram out = new Emitter().program(program);
        Debug.get().d(TAG, "generated " + out.code().size() + " instructions, "
                + out.slots().size() + " slots for " + out.name());
        return out;
    }

    private final class Emitter implements Declaration.ItemVisitor<Void>,
            Statement.StmtVisitor<Void>, Expr.ExprVisitor<Void> {

        private final SymbolTable symbols = new SymbolTable();
        private final ExpressionTyper typer = new ExpressionTyper(symbols);
        private final CodeBuffer code = new CodeBuffer();
        private final List<Slot> slots = new ArrayList<>();

        VmProgram program(Declaration.Program program) {
            code.emit(Opcode.START);
            block(program.block);
            code.emit(Opcode.STOP);
            return new VmProgram(program.displayName(), code.finish(), slots);
        }

        private void block(Declaration.Block block) {
            Label body = block.declaresProcedures() ? code.newLabel() : null;
            if (body != null) code.emitBranch(Opcode.JUMP, body);
            for (Declaration.Item item : block.declarations) {
                item.accept(this);
            }
            if (body != null) code.bind(body);
            block.body.accept(this);
        }

        // ---- declarations ----

        @Override
        public Void visitConstant(Declaration.Constant constant) {
            DataType type = typer.typeOf(constant.value);
            symbols.define(Symbol.constant(constant.name.lexeme, constant.name.position,
                    type, constantValue(constant.value)));
            return null;
        }

        @Override
        public Void visitVariables(Declaration.Variables variables) {
            for (Token name : variables.names) {
                Slot slot = new Slot(slots.size(), symbols.qualify(name.lexeme), variables.type);
                symbols.define(Symbol.variable(name.lexeme, name.position, slot));
                slots.add(slot);
                Debug.get().t(TAG, "slot " + slot);
            }
            return null;
        }

        @Override
        public Void visitProcedure(Declaration.Procedure procedure) {
            symbols.define(Symbol.procedure(procedure.name.lexeme, procedure.name.position, code.size()));
            Debug.get().t(TAG, "procedure " + procedure.name.lexeme + " at " + code.size());
            symbols.enter(procedure.name.lexeme);
            block(procedure.block);
            code.emit(Opcode.RETURN);
            symbols.exit();
            return null;
        }

        // ---- statements ----

        @Override
        public Void visitCompoundStmt(Statement.Compound stmt) {
            for (Statement.Stmt s : stmt.statements) {
                s.accept(this);
            }
            return null;
        }

        @Override
        public Void visitAssignStmt(Statement.Assign stmt) {
            Symbol target = variable(stmt.target.name, "assign to");
            DataType valueType = typer.typeOf(stmt.value);
            if (!assignable(target.type, valueType)) {
                throw new SemanticException(stmt.operator.position, "Type mismatch: cannot assign "
                        + valueType.keyword() + " to " + target.type.keyword() + " variable '" + target.name + "'");
            }
            emitAs(stmt.value, target.type);
            code.emit(Opcode.STOREG, target.slot.index);
            return null;
        }

        @Override
        public Void visitIfStmt(Statement.If stmt) {
            condition(stmt.condition, stmt.keyword);
            Label elseLabel = code.newLabel();
            code.emitBranch(Opcode.JZ, elseLabel);
            stmt.thenBranch.accept(this);
            if (stmt.elseBranch == null) {
                code.bind(elseLabel);
                return null;
            }
            Label end = code.newLabel();
            code.emitBranch(Opcode.JUMP, end);
            code.bind(elseLabel);
            stmt.elseBranch.accept(this);
            code.bind(end);
            return null;
        }

        @Override
        public Void visitWhileStmt(Statement.While stmt) {
            Label top = code.newLabel();
            Label end = code.newLabel();
            code.bind(top);
            condition(stmt.condition, stmt.keyword);
            code.emitBranch(Opcode.JZ, end);
            stmt.body.accept(this);
            code.emitBranch(Opcode.JUMP, top);
            code.bind(end);
            return null;
        }

        @Override
        public Void visitRepeatStmt(Statement.Repeat stmt) {
            Label top = code.newLabel();
            code.bind(top);
            for (Statement.Stmt s : stmt.body) {
                s.accept(this);
            }
            condition(stmt.condition, stmt.keyword);
            code.emitBranch(Opcode.JZ, top);
            return null;
        }

        @Override
        public Void visitForStmt(Statement.For stmt) {
            Symbol counter = variable(stmt.variable.name, "use as loop counter");
            if (counter.type != DataType.INTEGER) {
                throw new SemanticException(stmt.variable.position(),
                        "Loop counter '" + counter.name + "' must be an integer variable");
            }
            requireType(stmt.from, DataType.INTEGER, "Loop start");
            requireType(stmt.to, DataType.INTEGER, "Loop limit");

            int slot = counter.slot.index;
            stmt.from.accept(this);
            code.emit(Opcode.STOREG, slot);

            Label top = code.newLabel();
            Label end = code.newLabel();
            code.bind(top);
            code.emit(Opcode.PUSHG, slot);
            stmt.to.accept(this);
            code.emit(stmt.downTo ? Opcode.SUPEQ : Opcode.INFEQ);
            code.emitBranch(Opcode.JZ, end);
            stmt.body.accept(this);
            code.emit(Opcode.PUSHG, slot);
            code.emit(Opcode.PUSHI, 1);
            code.emit(stmt.downTo ? Opcode.SUB : Opcode.ADD);
            code.emit(Opcode.STOREG, slot);
            code.emitBranch(Opcode.JUMP, top);
            code.bind(end);
            return null;
        }

        @Override
        public Void visitCallStmt(Statement.Call stmt) {
            Symbol s = symbols.lookup(stmt.name.lexeme);
            if (s != null) {
                if (s.kind != Symbol.Kind.PROCEDURE) {
                    throw new SemanticException(stmt.name.position, "'" + s.name + "' is a "
                            + s.kind.describe() + ", not a procedure");
                }
                if (!stmt.arguments.isEmpty()) {
                    throw new SemanticException(stmt.name.position, "Procedure '" + s.name
                            + "' takes no arguments but " + stmt.arguments.size() + " were given");
                }
                code.emit(Opcode.CALL, s.entry);
                return null;
            }

            switch (stmt.name.lexeme.toLowerCase(Locale.ROOT)) {
                case "write":
                    if (stmt.arguments.isEmpty()) {
                        throw new SemanticException(stmt.name.position, "write expects at least one argument");
                    }
                    write(stmt.arguments);
                    return null;
                case "writeln":
                    write(stmt.arguments);
                    code.emit(Opcode.WRITELN);
                    return null;
                case "read":
                case "readln":
                    read(stmt);
                    return null;
                default:
                    throw new SemanticException(stmt.name.position, "Undeclared procedure '" + stmt.name.lexeme + "'");
            }
        }

        @Override
        public Void visitEmptyStmt(Statement.Empty stmt) {
            return null;
        }

        private void write(List<Expr.ExprInterface> arguments) {
            for (Expr.ExprInterface arg : arguments) {
                DataType type = typer.typeOf(arg);
                arg.accept(this);
                code.emit(writeOpcode(type));
            }
        }

        private Opcode writeOpcode(DataType type) {
            switch (type) {
                case INTEGER: return Opcode.WRITEI;
                case REAL: return Opcode.WRITEF;
                case STRING: return Opcode.WRITES;
                case BOOLEAN: return Opcode.WRITEB;
                default: throw new IllegalStateException("no write instruction for " + type);
            }
        }

        private void read(Statement.Call stmt) {
            if (stmt.arguments.isEmpty()) {
                code.emit(Opcode.READ);
                code.emit(Opcode.POP);
                return;
            }
            for (Expr.ExprInterface arg : stmt.arguments) {
                if (!(arg instanceof Expr.Variable)) {
                    throw new SemanticException(arg.position(), stmt.name.lexeme + " arguments must be variables");
                }
                Symbol target = variable(((Expr.Variable) arg).name, "read into");
                code.emit(Opcode.READ);
                switch (target.type) {
                    case INTEGER:
                        code.emit(Opcode.ATOI);
                        break;
                    case REAL:
                        code.emit(Opcode.ATOF);
                        break;
                    case STRING:
                        break;
                    default:
                        throw new SemanticException(arg.position(), "Cannot read into "
                                + target.type.keyword() + " variable '" + target.name + "'");
                }
                code.emit(Opcode.STOREG, target.slot.index);
            }
        }

        // ---- expressions ----

        @Override
        public Void visitBinaryExpr(Expr.Binary expr) {
            DataType left = typer.typeOf(expr.left);
            DataType right = typer.typeOf(expr.right);
            DataType result = typer.typeOf(expr);
            switch (expr.operator.type) {
                case PLUS:
                    if (result == DataType.STRING) {
                        expr.left.accept(this);
                        expr.right.accept(this);
                        code.emit(Opcode.CONCAT);
                        return null;
                    }
                    return numeric(expr, result, Opcode.ADD, Opcode.FADD);
                case MINUS:
                    return numeric(expr, result, Opcode.SUB, Opcode.FSUB);
                case STAR:
                    return numeric(expr, result, Opcode.MUL, Opcode.FMUL);
                case SLASH:
                    checkDivisor(expr);
                    return numeric(expr, DataType.REAL, Opcode.FDIV, Opcode.FDIV);
                case DIV:
                    checkDivisor(expr);
                    return plain(expr, Opcode.DIV);
                case MOD:
                    checkDivisor(expr);
                    return plain(expr, Opcode.MOD);
                case AND:
                    return plain(expr, Opcode.AND);
                case OR:
                    return plain(expr, Opcode.OR);
                case EQUAL:
                case NOT_EQUAL: {
                    DataType operands = (left.isNumeric() && right.isNumeric()) ? widest(left, right) : left;
                    emitAs(expr.left, operands);
                    emitAs(expr.right, operands);
                    code.emit(Opcode.EQUAL);
                    if (expr.operator.type == TokenType.NOT_EQUAL) code.emit(Opcode.NOT);
                    return null;
                }
                case LESS:
                    return numeric(expr, widest(left, right), Opcode.INF, Opcode.FINF);
                case LESS_EQUAL:
                    return numeric(expr, widest(left, right), Opcode.INFEQ, Opcode.FINFEQ);
                case GREATER:
                    return numeric(expr, widest(left, right), Opcode.SUP, Opcode.FSUP);
                case GREATER_EQUAL:
                    return numeric(expr, widest(left, right), Opcode.SUPEQ, Opcode.FSUPEQ);
                default:
                    throw new IllegalStateException("not a binary operator: " + expr.operator);
            }
        }

        @Override
        public Void visitUnaryExpr(Expr.Unary expr) {
            DataType type = typer.typeOf(expr);
            expr.operand.accept(this);
            switch (expr.operator.type) {
                case NOT:
                    code.emit(Opcode.NOT);
                    break;
                case MINUS:
                    code.emit(type == DataType.REAL ? Opcode.FNEG : Opcode.NEG);
                    break;
                case PLUS:
                    break;
                default:
                    throw new IllegalStateException("not a unary operator: " + expr.operator);
            }
            return null;
        }

        @Override
        public Void visitIntegerLiteralExpr(Expr.IntegerLiteral expr) {
            code.emit(Opcode.PUSHI, expr.value);
            return null;
        }

        @Override
        public Void visitRealLiteralExpr(Expr.RealLiteral expr) {
            code.emit(Opcode.PUSHF, expr.value);
            return null;
        }

        @Override
        public Void visitStringLiteralExpr(Expr.StringLiteral expr) {
            code.emit(Opcode.PUSHS, expr.value);
            return null;
        }

        @Override
        public Void visitBooleanLiteralExpr(Expr.BooleanLiteral expr) {
            code.emit(Opcode.PUSHI, expr.value ? 1 : 0);
            return null;
        }

        @Override
        public Void visitVariableExpr(Expr.Variable expr) {
            Symbol s = symbols.resolve(expr.name.lexeme, expr.position());
            switch (s.kind) {
                case VARIABLE:
                    code.emit(Opcode.PUSHG, s.slot.index);
                    break;
                case CONSTANT:
                    pushConstant(s);
                    break;
                default:
                    throw new SemanticException(expr.position(), "Procedure '" + s.name + "' used as a value");
            }
            return null;
        }

        // ---- helpers ----

        private Void numeric(Expr.Binary expr, DataType result, Opcode intOp, Opcode realOp) {
            emitAs(expr.left, result);
            emitAs(expr.right, result);
            code.emit(result == DataType.REAL ? realOp : intOp);
            return null;
        }

        private Void plain(Expr.Binary expr, Opcode op) {
            expr.left.accept(this);
            expr.right.accept(this);
            code.emit(op);
            return null;
        }

        /** Emits the expression, widening an integer result when a real is wanted. */
        private void emitAs(Expr.ExprInterface expr, DataType wanted) {
            DataType actual = typer.typeOf(expr);
            expr.accept(this);
            if (actual == DataType.INTEGER && wanted == DataType.REAL) code.emit(Opcode.ITOF);
        }

        private void pushConstant(Symbol s) {
            switch (s.type) {
                case INTEGER:
                    code.emit(Opcode.PUSHI, (Integer) s.value);
                    break;
                case REAL:
                    code.emit(Opcode.PUSHF, (Double) s.value);
                    break;
                case STRING:
                    code.emit(Opcode.PUSHS, (String) s.value);
                    break;
                case BOOLEAN:
                    code.emit(Opcode.PUSHI, ((Boolean) s.value) ? 1 : 0);
                    break;
                default:
                    throw new IllegalStateException("unhandled constant type " + s.type);
            }
        }

        private void checkDivisor(Expr.Binary expr) {
            if (checkDivisionByZero && isZero(expr.right)) {
                throw new SemanticException(expr.operator.position, "Division by zero");
            }
        }

        private boolean isZero(Expr.ExprInterface expr) {
            if (expr instanceof Expr.IntegerLiteral) return ((Expr.IntegerLiteral) expr).value == 0;
            if (expr instanceof Expr.RealLiteral) return ((Expr.RealLiteral) expr).value == 0.0;
            if (expr instanceof Expr.Unary) {
                Expr.Unary u = (Expr.Unary) expr;
                return u.operator.type != TokenType.NOT && isZero(u.operand);
            }
            if (expr instanceof Expr.Variable) {
                Symbol s = symbols.lookup(((Expr.Variable) expr).name.lexeme);
                return s != null && s.kind == Symbol.Kind.CONSTANT
                        && s.value instanceof Number && ((Number) s.value).doubleValue() == 0.0;
            }
            return false;
        }

        private void condition(Expr.ExprInterface condition, Token keyword) {
            requireType(condition, DataType.BOOLEAN, "Condition of '" + keyword.type.spelling + "'");
            condition.accept(this);
        }

        private void requireType(Expr.ExprInterface expr, DataType wanted, String what) {
            DataType actual = typer.typeOf(expr);
            if (actual != wanted) {
                throw new SemanticException(expr.position(), what + " must be "
                        + wanted.keyword() + ", found " + actual.keyword());
            }
        }

        private Symbol variable(Token name, String action) {
            Symbol s = symbols.resolve(name.lexeme, name.position);
            if (s.kind != Symbol.Kind.VARIABLE) {
                throw new SemanticException(name.position, "Cannot " + action + " "
                        + s.kind.describe() + " '" + s.name + "'");
            }
            return s;
        }

        private Object constantValue(Expr.ExprInterface value) {
            if (value instanceof Expr.IntegerLiteral) return ((Expr.IntegerLiteral) value).value;
            if (value instanceof Expr.RealLiteral) return ((Expr.RealLiteral) value).value;
            if (value instanceof Expr.StringLiteral) return ((Expr.StringLiteral) value).value;
            if (value instanceof Expr.BooleanLiteral) return ((Expr.BooleanLiteral) value).value;
            if (value instanceof Expr.Unary) {
                Expr.Unary u = (Expr.Unary) value;
                Object inner = constantValue(u.operand);
                if (u.operator.type != TokenType.MINUS) return inner;
                if (inner instanceof Integer) return -((Integer) inner);
                if (inner instanceof Double) return -((Double) inner);
            }
            throw new IllegalStateException("not a constant expression at " + value.position());
        }

    }

    private static boolean assignable(DataType target, DataType value) {
        return target == value || (target == DataType.REAL && value == DataType.INTEGER);
    }

    private static DataType widest(DataType left, DataType right) {
        return (left == DataType.REAL || right == DataType.REAL) ? DataType.REAL : DataType.INTEGER;
    }
}
