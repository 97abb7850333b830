package com.pascalite.compiler.codegen;

/** A branch target whose index is fixed when it is bound. */
public final class Label {
    private final int id;
    private int index = -1;

    Label(int id) {
        this.id = id;
    }

    public boolean isBound() {
        return index >= 0;
    }

    public int index() {
        if (!isBound()) throw new IllegalStateException("label L" + id + " is not bound");
        return index;
    }

    void bindTo(int index) {
        if (isBound()) throw new IllegalStateException("label L" + id + " bound twice");
        this.index = index;
    }

    @Override
    public String toString() {
        return "L" + id + (isBound() ? "@" + index : "");
    }
}
