package com.pascalite.compiler.codegen;

import com.pascalite.compiler.parser.DataType;
import com.pascalite.compiler.parser.SourcePosition;
import com.pascalite.compiler.vm.Slot;

/** A declared name. Which fields are meaningful depends on {@link #kind}. */
public final class Symbol {

    public enum Kind {
        VARIABLE,
        CONSTANT,
        PROCEDURE;

        public String describe() {
            return name().toLowerCase(java.util.Locale.ROOT);
        }
    }

    public final String name;
    public final Kind kind;
    public final SourcePosition declaredAt;
    /** Null for procedures. */
    public final DataType type;
    /** Variables only. */
    public final Slot slot;
    /** Constants only: Integer, Double, String or Boolean. */
    public final Object value;
    /** Procedures only: index of the first body instruction. */
    public final int entry;

    private Symbol(String name, Kind kind, SourcePosition declaredAt, DataType type,
                   Slot slot, Object value, int entry) {
        this.name = name;
        this.kind = kind;
        this.declaredAt = declaredAt;
        this.type = type;
        this.slot = slot;
        this.value = value;
        this.entry = entry;
    }

    public static Symbol variable(String name, SourcePosition at, Slot slot) {
        return new Symbol(name, Kind.VARIABLE, at, slot.type, slot, null, -1);
    }

    public static Symbol constant(String name, SourcePosition at, DataType type, Object value) {
        return new Symbol(name, Kind.CONSTANT, at, type, null, value, -1);
    }

    public static Symbol procedure(String name, SourcePosition at, int entry) {
        return new Symbol(name, Kind.PROCEDURE, at, null, null, null, entry);
    }

    @Override
    public String toString() {
        return kind.describe() + " " + name + (type == null ? "" : " : " + type.keyword());
    }
}
