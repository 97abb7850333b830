package com.pascalite.compiler.vm;

/** Fault raised while executing a program; carries the failing instruction index. */
public final class VmRuntimeException extends RuntimeException {
    private final int pc;

    public VmRuntimeException(int pc, String message) {
        super("[pc " + pc + "] " + message);
        this.pc = pc;
    }

    public VmRuntimeException(int pc, String message, Throwable cause) {
        super("[pc " + pc + "] " + message, cause);
        this.pc = pc;
    }

    public int getPc() {
        return pc;
    }
}
