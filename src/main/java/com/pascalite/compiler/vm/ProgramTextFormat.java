package com.pascalite.compiler.vm;

import java.util.ArrayList;
import java.util.List;

import com.pascalite.compiler.parser.DataType;

/**
 * Line-per-instruction text encoding of a {@link VmProgram}.
 *
 * <pre>
 * .program demo
 * .slot 0 x integer
 * START
 * PUSHI 2
 * PUSHS "a \"quoted\" word"
 * JZ 7
 * </pre>
 *
 * The instruction index is the position among opcode lines; branch operands
 * are absolute indices. Blank lines and lines starting with {@code ;} are
 * ignored when reading.
 */
public final class ProgramTextFormat {

    private ProgramTextFormat() {}

    public static String write(VmProgram program) {
        StringBuilder sb = new StringBuilder();
        sb.append(".program ").append(program.name()).append('\n');
        for (Slot slot : program.slots()) {
            sb.append(".slot ").append(slot).append('\n');
        }
        for (Instruction in : program.code()) {
            sb.append(format(in)).append('\n');
        }
        return sb.toString();
    }

    public static String format(Instruction in) {
        switch (in.op.operand) {
            case NONE:
                return in.op.name();
            case STRING:
                return in.op.name() + " " + quote(in.stringOperand());
            default:
                return in.op.name() + " " + in.operand;
        }
    }

    public static VmProgram read(String text) {
        String name = null;
        List<Slot> slots = new ArrayList<>();
        List<Instruction> code = new ArrayList<>();

        String[] lines = text.split("\r?\n", -1);
        for (int i = 0; i < lines.length; i++) {
            int lineNo = i + 1;
            String line = lines[i].trim();
            if (line.isEmpty() || line.startsWith(";")) continue;

            if (line.startsWith(".program")) {
                name = line.substring(".program".length()).trim();
                if (name.isEmpty()) throw error(lineNo, "missing program name");
            } else if (line.startsWith(".slot")) {
                slots.add(parseSlot(lineNo, line));
            } else {
                code.add(parseInstruction(lineNo, line));
            }
        }
        if (name == null) throw new ProgramFormatException("missing .program directive");
        try {
            return new VmProgram(name, code, slots);
        } catch (IllegalStateException e) {
            throw new ProgramFormatException(e.getMessage(), e);
        }
    }

    private static Slot parseSlot(int lineNo, String line) {
        String[] parts = line.split("\\s+");
        if (parts.length != 4) throw error(lineNo, "expected '.slot <index> <name> <type>'");
        try {
            return new Slot(Integer.parseInt(parts[1]), parts[2], DataType.fromKeyword(parts[3]));
        } catch (IllegalArgumentException e) {
            throw error(lineNo, e.getMessage());
        }
    }

    private static Instruction parseInstruction(int lineNo, String line) {
        int space = indexOfWhitespace(line);
        String mnemonic = (space < 0) ? line : line.substring(0, space);
        String rest = (space < 0) ? "" : line.substring(space + 1).trim();

        Opcode op;
        try {
            op = Opcode.valueOf(mnemonic);
        } catch (IllegalArgumentException e) {
            throw error(lineNo, "unknown opcode '" + mnemonic + "'");
        }

        if (op.operand == Opcode.Operand.NONE) {
            if (!rest.isEmpty()) throw error(lineNo, op + " takes no operand");
            return Instruction.of(op);
        }
        if (rest.isEmpty()) throw error(lineNo, op + " requires an operand");
        try {
            switch (op.operand) {
                case REAL:
                    return Instruction.of(op, Double.parseDouble(rest));
                case STRING:
                    return Instruction.of(op, unquote(lineNo, rest));
                default:
                    return Instruction.of(op, Integer.parseInt(rest));
            }
        } catch (NumberFormatException e) {
            throw error(lineNo, "bad operand '" + rest + "' for " + op);
        }
    }

    static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default: sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    private static String unquote(int lineNo, String s) {
        if (s.length() < 2 || s.charAt(0) != '"' || s.charAt(s.length() - 1) != '"') {
            throw error(lineNo, "string operand must be double-quoted");
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i < s.length() - 1; i++) {
            char c = s.charAt(i);
            if (c == '"') throw error(lineNo, "unescaped quote in string operand");
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (++i >= s.length() - 1) throw error(lineNo, "dangling escape in string operand");
            char e = s.charAt(i);
            switch (e) {
                case '"': sb.append('"'); break;
                case '\\': sb.append('\\'); break;
                case 'n': sb.append('\n'); break;
                case 'r': sb.append('\r'); break;
                case 't': sb.append('\t'); break;
                default: throw error(lineNo, "unknown escape '\\" + e + "'");
            }
        }
        return sb.toString();
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) return i;
        }
        return -1;
    }

    private static ProgramFormatException error(int lineNo, String message) {
        return new ProgramFormatException("line " + lineNo + ": " + message);
    }
}
