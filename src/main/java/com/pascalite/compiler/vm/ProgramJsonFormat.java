package com.pascalite.compiler.vm;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pascalite.compiler.parser.DataType;

/**
 * JSON encoding of a {@link VmProgram}:
 * {@code {"program": "demo", "slots": [{"slot": 0, "name": "x", "type": "integer"}],
 * "code": [{"op": "PUSHI", "arg": 2}, {"op": "ADD"}]}}.
 */
public final class ProgramJsonFormat {

    private static final ObjectMapper om = new ObjectMapper();

    private ProgramJsonFormat() {}

    public static ObjectNode toJson(VmProgram program) {
        ObjectNode root = om.createObjectNode();
        root.put("program", program.name());

        ArrayNode slots = root.putArray("slots");
        for (Slot slot : program.slots()) {
            ObjectNode s = slots.addObject();
            s.put("slot", slot.index);
            s.put("name", slot.name);
            s.put("type", slot.type.keyword());
        }

        ArrayNode code = root.putArray("code");
        for (Instruction in : program.code()) {
            ObjectNode n = code.addObject();
            n.put("op", in.op.name());
            switch (in.op.operand) {
                case NONE:
                    break;
                case REAL:
                    n.put("arg", in.realOperand());
                    break;
                case STRING:
                    n.put("arg", in.stringOperand());
                    break;
                default:
                    n.put("arg", in.intOperand());
            }
        }
        return root;
    }

    public static String write(VmProgram program) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(program));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("program serialization failed", e);
        }
    }

    public static VmProgram read(String json) {
        JsonNode root;
        try {
            root = om.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ProgramFormatException("invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) throw new ProgramFormatException("expected a JSON object");

        String name = root.path("program").asText(null);
        if (name == null || name.isEmpty()) throw new ProgramFormatException("missing 'program'");

        List<Slot> slots = new ArrayList<>();
        for (JsonNode s : root.path("slots")) {
            if (!s.path("slot").isInt() || !s.path("name").isTextual() || !s.path("type").isTextual()) {
                throw new ProgramFormatException("malformed slot entry: " + s);
            }
            try {
                slots.add(new Slot(s.get("slot").asInt(), s.get("name").asText(),
                        DataType.fromKeyword(s.get("type").asText())));
            } catch (IllegalArgumentException e) {
                throw new ProgramFormatException(e.getMessage(), e);
            }
        }

        List<Instruction> code = new ArrayList<>();
        int index = 0;
        for (JsonNode n : root.path("code")) {
            code.add(instruction(index++, n));
        }

        try {
            return new VmProgram(name, code, slots);
        } catch (IllegalStateException e) {
            throw new ProgramFormatException(e.getMessage(), e);
        }
    }

    private static Instruction instruction(int index, JsonNode n) {
        Opcode op;
        try {
            op = Opcode.valueOf(n.path("op").asText(""));
        } catch (IllegalArgumentException e) {
            throw new ProgramFormatException("instruction " + index + ": unknown opcode " + n.path("op"));
        }
        JsonNode arg = n.get("arg");
        switch (op.operand) {
            case NONE:
                if (arg != null) throw new ProgramFormatException("instruction " + index + ": " + op + " takes no operand");
                return Instruction.of(op);
            case REAL:
                if (arg == null || !arg.isNumber()) throw badArg(index, op);
                return Instruction.of(op, arg.asDouble());
            case STRING:
                if (arg == null || !arg.isTextual()) throw badArg(index, op);
                return Instruction.of(op, arg.asText());
            default:
                if (arg == null || !arg.isInt()) throw badArg(index, op);
                return Instruction.of(op, arg.asInt());
        }
    }

    private static ProgramFormatException badArg(int index, Opcode op) {
        return new ProgramFormatException("instruction " + index + ": missing or mistyped operand for " + op);
    }
}
