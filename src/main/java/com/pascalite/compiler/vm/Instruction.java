package com.pascalite.compiler.vm;

import java.util.Objects;

/** One immutable {opcode, operand} tuple. */
public final class Instruction {
    public final Opcode op;
    /** Integer, Double or String matching {@link Opcode#operand}; null for {@code NONE}. */
    public final Object operand;

    private Instruction(Opcode op, Object operand) {
        this.op = op;
        this.operand = operand;
    }

    public static Instruction of(Opcode op) {
        if (op.operand != Opcode.Operand.NONE) {
            throw new IllegalArgumentException(op + " requires an operand");
        }
        return new Instruction(op, null);
    }

    public static Instruction of(Opcode op, int value) {
        switch (op.operand) {
            case INTEGER:
            case SLOT:
            case TARGET:
                return new Instruction(op, value);
            default:
                throw new IllegalArgumentException(op + " does not take an integer operand");
        }
    }

    public static Instruction of(Opcode op, double value) {
        if (op.operand != Opcode.Operand.REAL) {
            throw new IllegalArgumentException(op + " does not take a real operand");
        }
        return new Instruction(op, value);
    }

    public static Instruction of(Opcode op, String value) {
        if (op.operand != Opcode.Operand.STRING) {
            throw new IllegalArgumentException(op + " does not take a string operand");
        }
        return new Instruction(op, Objects.requireNonNull(value));
    }

    public int intOperand() {
        return (Integer) operand;
    }

    public double realOperand() {
        return (Double) operand;
    }

    public String stringOperand() {
        return (String) operand;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Instruction)) return false;
        Instruction other = (Instruction) o;
        return op == other.op && Objects.equals(operand, other.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, operand);
    }

    @Override
    public String toString() {
        return ProgramTextFormat.format(this);
    }
}
