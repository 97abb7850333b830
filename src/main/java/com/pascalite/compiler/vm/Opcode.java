package com.pascalite.compiler.vm;

/**
 * Stack machine operations. Integer and real arithmetic are separate
 * families; {@link #ITOF} widens the integer on top of the stack.
 */
public enum Opcode {
    START(Operand.NONE),
    STOP(Operand.NONE),

    PUSHI(Operand.INTEGER),
    PUSHF(Operand.REAL),
    PUSHS(Operand.STRING),
    PUSHG(Operand.SLOT),
    STOREG(Operand.SLOT),
    POP(Operand.NONE),

    ADD(Operand.NONE),
    SUB(Operand.NONE),
    MUL(Operand.NONE),
    DIV(Operand.NONE),
    MOD(Operand.NONE),
    NEG(Operand.NONE),

    FADD(Operand.NONE),
    FSUB(Operand.NONE),
    FMUL(Operand.NONE),
    FDIV(Operand.NONE),
    FNEG(Operand.NONE),
    ITOF(Operand.NONE),

    CONCAT(Operand.NONE),

    EQUAL(Operand.NONE),
    INF(Operand.NONE),
    INFEQ(Operand.NONE),
    SUP(Operand.NONE),
    SUPEQ(Operand.NONE),
    FINF(Operand.NONE),
    FINFEQ(Operand.NONE),
    FSUP(Operand.NONE),
    FSUPEQ(Operand.NONE),

    NOT(Operand.NONE),
    AND(Operand.NONE),
    OR(Operand.NONE),

    JUMP(Operand.TARGET),
    JZ(Operand.TARGET),
    CALL(Operand.TARGET),
    RETURN(Operand.NONE),

    WRITEI(Operand.NONE),
    WRITEF(Operand.NONE),
    WRITES(Operand.NONE),
    WRITEB(Operand.NONE),
    WRITELN(Operand.NONE),
    READ(Operand.NONE),
    ATOI(Operand.NONE),
    ATOF(Operand.NONE);

    /** What the single operand of an instruction means, if it has one. */
    public enum Operand {
        NONE,
        INTEGER,
        REAL,
        STRING,
        SLOT,
        TARGET
    }

    public final Operand operand;

    Opcode(Operand operand) {
        this.operand = operand;
    }

    public boolean isBranch() {
        return operand == Operand.TARGET;
    }
}
