package com.pascalite.compiler.vm;

import java.util.Objects;

import com.pascalite.compiler.parser.DataType;

/** A storage cell reserved for one declared variable. */
public final class Slot {
    public final int index;
    /** Dotted scope path, e.g. {@code x} or {@code swap.tmp}. */
    public final String name;
    public final DataType type;

    public Slot(int index, String name, DataType type) {
        this.index = index;
        this.name = name;
        this.type = type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Slot)) return false;
        Slot other = (Slot) o;
        return index == other.index && name.equals(other.name) && type == other.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, name, type);
    }

    @Override
    public String toString() {
        return index + " " + name + " " + type.keyword();
    }
}
