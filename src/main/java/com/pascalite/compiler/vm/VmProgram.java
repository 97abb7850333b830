package com.pascalite.compiler.vm;

import java.util.List;
import java.util.Objects;

/**
 * A generated program: instruction sequence plus the slot table of every
 * declared variable. The constructor rejects branch targets outside the
 * instruction sequence and slot operands outside the slot table.
 */
public final class VmProgram {
    private final String name;
    private final List<Instruction> code;
    private final List<Slot> slots;

    public VmProgram(String name, List<Instruction> code, List<Slot> slots) {
        this.name = name;
        this.code = List.copyOf(code);
        this.slots = List.copyOf(slots);
        validate();
    }

    public String name() {
        return name;
    }

    public List<Instruction> code() {
        return code;
    }

    public List<Slot> slots() {
        return slots;
    }

    public Slot slot(String slotName) {
        for (Slot s : slots) {
            if (s.name.equalsIgnoreCase(slotName)) return s;
        }
        return null;
    }

    private void validate() {
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i).index != i) {
                throw new IllegalStateException("slot table out of order at " + i + ": " + slots.get(i));
            }
        }
        for (int i = 0; i < code.size(); i++) {
            Instruction in = code.get(i);
            if (in.op.isBranch()) {
                int target = in.intOperand();
                if (target < 0 || target >= code.size()) {
                    throw new IllegalStateException("branch target out of range at " + i + ": " + in);
                }
            } else if (in.op.operand == Opcode.Operand.SLOT) {
                int slot = in.intOperand();
                if (slot < 0 || slot >= slots.size()) {
                    throw new IllegalStateException("slot out of range at " + i + ": " + in);
                }
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VmProgram)) return false;
        VmProgram other = (VmProgram) o;
        return name.equals(other.name) && code.equals(other.code) && slots.equals(other.slots);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, code, slots);
    }
}
