package com.pascalite.compiler.parser;

import java.util.List;

/**
 * Program-level structures. {@link Program} and {@link Block} have a fixed
 * shape and are walked directly; the entries of a declaration part are mixed,
 * so they dispatch through {@link ItemVisitor}.
 */
public class Declaration {

    /** One entry of a block's declaration part, in source order. */
    public interface Item {
        <R> R accept(ItemVisitor<R> visitor);
    }

    public interface ItemVisitor<R> {
        R visitConstant(Constant constant);
        R visitVariables(Variables variables);
        R visitProcedure(Procedure procedure);
    }

    public static final class Program {
        /** Null when the source has no {@code program X;} heading. */
        public final Token name;
        public final Block block;

        public Program(Token name, Block block) {
            this.name = name;
            this.block = block;
        }

        public String displayName() {
            return (name == null) ? "main" : name.lexeme;
        }
    }

    public static final class Block {
        public final List<Item> declarations;
        public final Statement.Compound body;

        public Block(List<Item> declarations, Statement.Compound body) {
            this.declarations = List.copyOf(declarations);
            this.body = body;
        }

        public boolean declaresProcedures() {
            for (Item item : declarations) {
                if (item instanceof Procedure) return true;
            }
            return false;
        }
    }

    /** name = value; the value is a literal, possibly signed. */
    public static final class Constant implements Item {
        public final Token name;
        public final Expr.ExprInterface value;

        public Constant(Token name, Expr.ExprInterface value) {
            this.name = name;
            this.value = value;
        }

        public <R> R accept(ItemVisitor<R> visitor) { return visitor.visitConstant(this); }
    }

    /** a, b, c : type; */
    public static final class Variables implements Item {
        public final List<Token> names;
        public final Token typeToken;
        public final DataType type;

        public Variables(List<Token> names, Token typeToken) {
            this.names = List.copyOf(names);
            this.typeToken = typeToken;
            this.type = DataType.fromKeyword(typeToken.lexeme);
        }

        public <R> R accept(ItemVisitor<R> visitor) { return visitor.visitVariables(this); }
    }

    public static final class Procedure implements Item {
        public final Token name;
        public final Block block;

        public Procedure(Token name, Block block) {
            this.name = name;
            this.block = block;
        }

        public <R> R accept(ItemVisitor<R> visitor) { return visitor.visitProcedure(this); }
    }
}
