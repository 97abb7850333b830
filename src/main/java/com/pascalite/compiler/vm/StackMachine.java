package com.pascalite.compiler.vm;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.Deque;

import com.pascalite.compiler.parser.DataType;
import com.pascalite.debug.Debug;

/**
 * Executes a {@link VmProgram}.
 *
 * Memory holds one value per slot, initialized from the slot type. The
 * operand stack holds Integer, Double and String values; booleans are the
 * integers 0 and 1. {@code STOP}, or running past the last instruction,
 * halts. A machine runs once; afterwards slot values can be read by name.
 */
public final class StackMachine {
    private static final String TAG = "pascalite.vm";

    public static final int DEFAULT_MAX_CALL_DEPTH = 1024;

    private final VmProgram program;
    private final BufferedReader in;
    private final PrintStream out;
    private final Object[] memory;
    private final Deque<Object> stack = new ArrayDeque<>();
    private final Deque<Integer> returns = new ArrayDeque<>();

    private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;
    private int pc = 0;
    private long steps = 0;
    private boolean ran = false;

    public StackMachine(VmProgram program, BufferedReader in, PrintStream out) {
        this.program = program;
        this.in = in;
        this.out = out;
        this.memory = new Object[program.slots().size()];
        for (Slot slot : program.slots()) {
            memory[slot.index] = initialValue(slot.type);
        }
    }

    public void setMaxCallDepth(int maxCallDepth) {
        if (maxCallDepth < 1) throw new IllegalArgumentException("maxCallDepth must be >= 1");
        this.maxCallDepth = maxCallDepth;
    }

    public void run() {
        if (ran) throw new IllegalStateException("machine already ran");
        ran = true;
        Debug.get().d(TAG, "running " + program.name() + " (" + program.code().size() + " instructions)");

        while (pc < program.code().size()) {
            Instruction insn = program.code().get(pc);
            if (Debug.get().enabled()) Debug.get().t(TAG, pc + ": " + insn + " stack=" + stack);
            steps++;
            if (!execute(insn)) break;
        }
        out.flush();
        Debug.get().d(TAG, "halted after " + steps + " steps");
    }

    /**
     * Value of the named slot after (or before) a run: Integer, Double,
     * String, or Boolean for boolean slots.
     */
    public Object valueOf(String slotName) {
        Slot slot = program.slot(slotName);
        if (slot == null) throw new IllegalArgumentException("no slot named " + slotName);
        Object v = memory[slot.index];
        if (slot.type == DataType.BOOLEAN) return ((Integer) v) != 0;
        return v;
    }

    public long steps() {
        return steps;
    }

    /** Returns false when the machine halts. */
    private boolean execute(Instruction insn) {
        int next = pc + 1;
        switch (insn.op) {
            case START:
                break;
            case STOP:
                return false;

            case PUSHI:
            case PUSHF:
            case PUSHS:
                stack.push(insn.operand);
                break;
            case PUSHG:
                stack.push(memory[insn.intOperand()]);
                break;
            case STOREG:
                memory[insn.intOperand()] = pop();
                break;
            case POP:
                pop();
                break;

            case ADD: {
                int b = popInt(), a = popInt();
                stack.push(a + b);
                break;
            }
            case SUB: {
                int b = popInt(), a = popInt();
                stack.push(a - b);
                break;
            }
            case MUL: {
                int b = popInt(), a = popInt();
                stack.push(a * b);
                break;
            }
            case DIV: {
                int b = popInt(), a = popInt();
                if (b == 0) throw fault("division by zero");
                stack.push(a / b);
                break;
            }
            case MOD: {
                int b = popInt(), a = popInt();
                if (b == 0) throw fault("division by zero");
                stack.push(a % b);
                break;
            }
            case NEG:
                stack.push(-popInt());
                break;

            case FADD: {
                double b = popReal(), a = popReal();
                stack.push(a + b);
                break;
            }
            case FSUB: {
                double b = popReal(), a = popReal();
                stack.push(a - b);
                break;
            }
            case FMUL: {
                double b = popReal(), a = popReal();
                stack.push(a * b);
                break;
            }
            case FDIV: {
                double b = popReal(), a = popReal();
                if (b == 0.0) throw fault("division by zero");
                stack.push(a / b);
                break;
            }
            case FNEG:
                stack.push(-popReal());
                break;
            case ITOF:
                stack.push((double) popInt());
                break;

            case CONCAT: {
                String b = popString(), a = popString();
                stack.push(a + b);
                break;
            }

            case EQUAL: {
                Object b = pop(), a = pop();
                boolean same = (a instanceof Double && b instanceof Double)
                        ? ((Double) a).doubleValue() == ((Double) b).doubleValue()
                        : a.equals(b);
                stack.push(same ? 1 : 0);
                break;
            }
            case INF: {
                int b = popInt(), a = popInt();
                stack.push(a < b ? 1 : 0);
                break;
            }
            case INFEQ: {
                int b = popInt(), a = popInt();
                stack.push(a <= b ? 1 : 0);
                break;
            }
            case SUP: {
                int b = popInt(), a = popInt();
                stack.push(a > b ? 1 : 0);
                break;
            }
            case SUPEQ: {
                int b = popInt(), a = popInt();
                stack.push(a >= b ? 1 : 0);
                break;
            }
            case FINF: {
                double b = popReal(), a = popReal();
                stack.push(a < b ? 1 : 0);
                break;
            }
            case FINFEQ: {
                double b = popReal(), a = popReal();
                stack.push(a <= b ? 1 : 0);
                break;
            }
            case FSUP: {
                double b = popReal(), a = popReal();
                stack.push(a > b ? 1 : 0);
                break;
            }
            case FSUPEQ: {
                double b = popReal(), a = popReal();
                stack.push(a >= b ? 1 : 0);
                break;
            }

            case NOT:
                stack.push(popInt() == 0 ? 1 : 0);
                break;
            case AND: {
                int b = popInt(), a = popInt();
                stack.push(a != 0 && b != 0 ? 1 : 0);
                break;
            }
            case OR: {
                int b = popInt(), a = popInt();
                stack.push(a != 0 || b != 0 ? 1 : 0);
                break;
            }

            case JUMP:
                next = insn.intOperand();
                break;
            case JZ:
                if (popInt() == 0) next = insn.intOperand();
                break;
            case CALL:
                if (returns.size() >= maxCallDepth) throw fault("max call depth exceeded (" + maxCallDepth + ")");
                returns.push(next);
                next = insn.intOperand();
                break;
            case RETURN:
                if (returns.isEmpty()) throw fault("RETURN without CALL");
                next = returns.pop();
                break;

            case WRITEI:
                out.print(popInt());
                break;
            case WRITEF:
                out.print(popReal());
                break;
            case WRITES:
                out.print(popString());
                break;
            case WRITEB:
                out.print(popInt() != 0 ? "TRUE" : "FALSE");
                break;
            case WRITELN:
                out.println();
                break;
            case READ:
                stack.push(readLine());
                break;
            case ATOI: {
                String s = popString().trim();
                try {
                    stack.push(Integer.parseInt(s));
                } catch (NumberFormatException e) {
                    throw fault("not an integer: '" + s + "'", e);
                }
                break;
            }
            case ATOF: {
                String s = popString().trim();
                try {
                    stack.push(Double.parseDouble(s));
                } catch (NumberFormatException e) {
                    throw fault("not a real: '" + s + "'", e);
                }
                break;
            }
            default:
                throw fault("unsupported opcode " + insn.op);
        }
        pc = next;
        return true;
    }

    private String readLine() {
        out.flush();
        try {
            String line = in.readLine();
            return (line == null) ? "" : line;
        } catch (IOException e) {
            throw fault("read failed: " + e.getMessage(), e);
        }
    }

    private Object pop() {
        if (stack.isEmpty()) throw fault("stack underflow");
        return stack.pop();
    }

    private int popInt() {
        Object v = pop();
        if (!(v instanceof Integer)) throw fault("expected integer on stack, found " + describe(v));
        return (Integer) v;
    }

    private double popReal() {
        Object v = pop();
        if (!(v instanceof Double)) throw fault("expected real on stack, found " + describe(v));
        return (Double) v;
    }

    private String popString() {
        Object v = pop();
        if (!(v instanceof String)) throw fault("expected string on stack, found " + describe(v));
        return (String) v;
    }

    private static String describe(Object v) {
        return v.getClass().getSimpleName() + " " + v;
    }

    private VmRuntimeException fault(String message) {
        return new VmRuntimeException(pc, message);
    }

    private VmRuntimeException fault(String message, Throwable cause) {
        return new VmRuntimeException(pc, message, cause);
    }

    private static Object initialValue(DataType type) {
        switch (type) {
            case INTEGER:
            case BOOLEAN:
                return 0;
            case REAL:
                return 0.0;
            case STRING:
                return "";
            default:
                throw new IllegalStateException("unhandled type " + type);
        }
    }
}
