package com.pascalite.compiler;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import com.pascalite.compiler.codegen.CodeGenerator;
import com.pascalite.compiler.parser.Declaration;
import com.pascalite.compiler.parser.Lexer;
import com.pascalite.compiler.parser.Parser;
import com.pascalite.compiler.parser.Token;
import com.pascalite.compiler.tree.TreeJsonWriter;
import com.pascalite.compiler.tree.TreePrinter;
import com.pascalite.compiler.vm.ProgramJsonFormat;
import com.pascalite.compiler.vm.ProgramTextFormat;
import com.pascalite.compiler.vm.StackMachine;
import com.pascalite.compiler.vm.VmProgram;
import com.pascalite.debug.Debug;

/**
 * Compiler engine: lexer, parser, tree printer, code generator and stack machine
 * behind one object.
 *
 * - Every call compiles from scratch; nothing is shared between calls
 * - Lexical, syntax and semantic failures are thrown as CompileException subclasses
 * - Runtime faults of the stack machine are thrown as VmRuntimeException
 */
public class Pascalite {
    private static final String TAG = "pascalite.compiler";

    private boolean checkDivisionByZero = true;
    private int maxCallDepth = StackMachine.DEFAULT_MAX_CALL_DEPTH;

    /** Reject division by a literal or constant zero at compile time. Default true. */
    public void setCheckDivisionByZero(boolean check) { this.checkDivisionByZero = check; }

    public boolean isCheckDivisionByZero() { return checkDivisionByZero; }

    /** Maximum procedure nesting at run time. */
    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("maxCallDepth must be >= 1");
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    public List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    public Declaration.Program parse(String source) {
        return new Parser(new Lexer(source)).parse();
    }

    public String visualize(String source) {
        return TreePrinter.print(parse(source));
    }

    public String visualizeJson(String source) {
        return TreeJsonWriter.write(parse(source));
    }

    public VmProgram compile(String source) {
        Declaration.Program tree = parse(source);
        VmProgram program = new CodeGenerator(checkDivisionByZero).generate(tree);
        Debug.get().i(TAG, "compiled " + program.name() + ": " + program.code().size() + " instructions");
        return program;
    }

    public String compileToText(String source) {
        return ProgramTextFormat.write(compile(source));
    }

    public String compileToJson(String source) {
        return ProgramJsonFormat.write(compile(source));
    }

    /** Runs a compiled program to completion and returns the halted machine. */
    public StackMachine execute(VmProgram program, BufferedReader in, PrintStream out) {
        StackMachine vm = new StackMachine(program, in, out);
        vm.setMaxCallDepth(maxCallDepth);
        vm.run();
        return vm;
    }

    public StackMachine run(String source, BufferedReader in, PrintStream out) {
        return execute(compile(source), in, out);
    }

    /** Compiles and runs {@code source} with {@code input} as its stdin; returns everything it wrote. */
    public String runForOutput(String source, String input) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        run(source, new BufferedReader(new StringReader(input == null ? "" : input)), out);
        out.flush();
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
