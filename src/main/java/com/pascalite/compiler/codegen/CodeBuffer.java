package com.pascalite.compiler.codegen;

import java.util.ArrayList;
import java.util.List;

import com.pascalite.compiler.vm.Instruction;
import com.pascalite.compiler.vm.Opcode;

/**
 * Append-only instruction list with forward branches. A branch to a label
 * that is not bound yet is recorded in the patch list and rewritten by
 * {@link #finish()}.
 */
public final class CodeBuffer {

    private static final class Patch {
        final int at;
        final Opcode op;
        final Label label;

        Patch(int at, Opcode op, Label label) {
            this.at = at;
            this.op = op;
            this.label = label;
        }
    }

    private final List<Instruction> code = new ArrayList<>();
    private final List<Patch> patches = new ArrayList<>();
    private int labels = 0;
    private boolean finished = false;

    public int size() {
        return code.size();
    }

    public void emit(Opcode op) {
        append(Instruction.of(op));
    }

    public void emit(Opcode op, int operand) {
        append(Instruction.of(op, operand));
    }

    public void emit(Opcode op, double operand) {
        append(Instruction.of(op, operand));
    }

    public void emit(Opcode op, String operand) {
        append(Instruction.of(op, operand));
    }

    public Label newLabel() {
        return new Label(labels++);
    }

    /** Binds the label to the index of the next instruction. */
    public void bind(Label label) {
        label.bindTo(code.size());
    }

    public void emitBranch(Opcode op, Label label) {
        if (!op.isBranch()) throw new IllegalArgumentException(op + " is not a branch");
        if (label.isBound()) {
            append(Instruction.of(op, label.index()));
        } else {
            patches.add(new Patch(code.size(), op, label));
            append(Instruction.of(op, 0));
        }
    }

    /** Resolves every pending branch and returns the final instruction list. */
    public List<Instruction> finish() {
        if (finished) throw new IllegalStateException("buffer already finished");
        for (Patch p : patches) {
            code.set(p.at, Instruction.of(p.op, p.label.index()));
        }
        patches.clear();
        finished = true;
        return List.copyOf(code);
    }

    private void append(Instruction in) {
        if (finished) throw new IllegalStateException("buffer already finished");
        code.add(in);
    }
}
