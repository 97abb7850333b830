import org.junit.jupiter.api.Test;

import com.pascalite.compiler.Pascalite;
import com.pascalite.compiler.vm.StackMachine;
import com.pascalite.compiler.vm.VmProgram;
import com.pascalite.compiler.vm.VmRuntimeException;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class PascaliteExecutionTest {

    static String resource(String name) throws IOException {
        try (InputStream in = PascaliteExecutionTest.class.getResourceAsStream("/programs/" + name)) {
            assertNotNull(in, "missing test program " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static String run(String source) {
        return run(source, "");
    }

    private static String run(String source, String input) {
        return new Pascalite().runForOutput(source, input).replace("\r\n", "\n");
    }

    private static StackMachine execute(String source) {
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        return new Pascalite().run(source, new BufferedReader(new StringReader("")), new PrintStream(sink));
    }

    @Test
    void integerArithmetic_matchesReferenceEvaluation() {
        Object[][] cases = {
                {"2 + 3 * 4", 14},
                {"(2 + 3) * 4", 20},
                {"10 - 4 - 3", 3},
                {"2 * (3 + 4) - 5", 9},
                {"-2 + 5", 3},
                {"-(2 + 3) * 2", -10},
                {"17 div 5", 3},
                {"17 mod 5", 2},
                {"100 div 7 * 7 + 100 mod 7", 100},
                {"((((1))))", 1},
        };
        for (Object[] c : cases) {
            StackMachine vm = execute("var r: integer; begin r := " + c[0] + " end.");
            assertEquals(c[1], vm.valueOf("r"), "r := " + c[0]);
        }
    }

    @Test
    void realArithmetic_matchesReferenceEvaluation() {
        Object[][] cases = {
                {"7 / 2", 3.5},
                {"(1 + 2) / 4", 0.75},
                {"1 + 10 / 4", 3.5},
                {"2.5 * 2", 5.0},
                {"-1.5 + 1", -0.5},
        };
        for (Object[] c : cases) {
            StackMachine vm = execute("var r: real; begin r := " + c[0] + " end.");
            assertEquals((double) c[1], (double) vm.valueOf("r"), 1e-12, "r := " + c[0]);
        }
    }

    @Test
    void writeln_printsEachType() {
        assertEquals("7 2.5 TRUE ok\n", run("begin writeln(7, ' ', 2.5, ' ', true, ' ', 'ok') end."));
        assertEquals("ab", run("begin write('a'); write('b') end."));
    }

    @Test
    void realEquality_negativeZeroEqualsZero() {
        String src = "var r: real;\n" +
                "begin\n" +
                "  r := -0.0;\n" +
                "  writeln(r = 0.0, ' ', r <> 0.0, ' ', r <= 0.0, ' ', r >= 0.0)\n" +
                "end.";
        assertEquals("TRUE FALSE TRUE TRUE\n", run(src));
    }

    @Test
    void loops_program() throws IOException {
        assertEquals("sum=15\n321\n6\n3 2 1 \n", run(resource("loops.pas")));
    }

    @Test
    void procedure_swapsGlobals() throws IOException {
        assertEquals("2 1\n", run(resource("swap.pas")));
    }

    @Test
    void readln_convertsInput() throws IOException {
        assertEquals("hi bob 42 2.5\n", run(resource("greet.pas"), "bob\n21\n5\n"));
    }

    @Test
    void ifElse_andDanglingElse() {
        String src = "var n: integer;\n" +
                "begin\n" +
                "  n := 7;\n" +
                "  if n mod 2 = 0 then writeln('even') else writeln('odd');\n" +
                "  if n > 5 then if n > 10 then writeln('big') else writeln('medium')\n" +
                "end.";
        assertEquals("odd\nmedium\n", run(src));
    }

    @Test
    void constants_ofEveryType() {
        String src = "const n = 3; pi = 3.5; greeting = 'hey'; neg = -2; flag = true;\n" +
                "begin writeln(n * neg, ' ', pi, ' ', greeting, ' ', flag) end.";
        assertEquals("-6 3.5 hey TRUE\n", run(src));
    }

    @Test
    void stringsBooleansAndMixedComparisons() {
        String src = "var f: boolean;\n" +
                "begin\n" +
                "  f := (1 < 2) and not (3 = 4);\n" +
                "  writeln('ab' + 'cd', ' ', 2 < 2.5, ' ', 3 = 3.0, ' ', 'x' <> 'y', ' ', f or false)\n" +
                "end.";
        assertEquals("abcd TRUE TRUE TRUE TRUE\n", run(src));
        assertEquals(Boolean.TRUE, execute(src.replace("writeln", "write")).valueOf("f"));
    }

    @Test
    void integerWidening_onAssignment() {
        assertEquals("3.5\n3.0\n", run("var r: real; begin r := 1 + 2.5; writeln(r); r := 3; writeln(r) end."));
    }

    @Test
    void recursion_withSharedGlobals() {
        String src = "var n, acc: integer;\n" +
                "procedure down;\n" +
                "begin\n" +
                "  if n > 0 then begin acc := acc + n; n := n - 1; down end\n" +
                "end;\n" +
                "begin n := 4; acc := 0; down; writeln(acc) end.";
        assertEquals("10\n", run(src));
    }

    @Test
    void nestedProcedures() {
        String src = "var log: string;\n" +
                "procedure outer;\n" +
                "  procedure inner; begin log := log + 'i' end;\n" +
                "begin log := log + 'o'; inner; inner end;\n" +
                "begin outer; outer; write(log) end.";
        assertEquals("oiioii", run(src));
    }

    @Test
    void unboundedRecursion_hitsCallDepthLimit() {
        Pascalite engine = new Pascalite();
        engine.setMaxCallDepth(10);
        VmRuntimeException e = assertThrows(VmRuntimeException.class,
                () -> engine.runForOutput("procedure spin; begin spin end; begin spin end.", ""));
        assertTrue(e.getMessage().contains("max call depth"), e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> engine.setMaxCallDepth(0));
    }

    @Test
    void runtimeDivisionByZero() {
        VmRuntimeException e = assertThrows(VmRuntimeException.class,
                () -> run("var z: integer; begin z := 0; writeln(10 div z) end."));
        assertTrue(e.getMessage().startsWith("[pc "), e.getMessage());

        Pascalite engine = new Pascalite();
        engine.setCheckDivisionByZero(false);
        VmProgram p = engine.compile("var x: integer; begin x := 1 div 0 end.");
        assertThrows(VmRuntimeException.class,
                () -> engine.execute(p, new BufferedReader(new StringReader("")), new PrintStream(new ByteArrayOutputStream())));
    }

    @Test
    void readln_badNumber_isRuntimeError() {
        assertThrows(VmRuntimeException.class, () -> run("var n: integer; begin readln(n) end.", "abc\n"));
    }

    @Test
    void readln_atEndOfInput_readsEmptyString() {
        assertEquals("[]", run("var s: string; begin readln(s); write('[', s, ']') end.", ""));
    }

    @Test
    void readln_withoutArguments_skipsLine() {
        assertEquals("keep", run("var s: string; begin readln; readln(s); write(s) end.", "skip\nkeep\n"));
    }

    @Test
    void memory_initializedFromSlotTypes() {
        StackMachine vm = execute("var i: integer; r: real; s: string; b: boolean; begin end.");
        assertEquals(0, vm.valueOf("i"));
        assertEquals(0.0, vm.valueOf("r"));
        assertEquals("", vm.valueOf("s"));
        assertEquals(Boolean.FALSE, vm.valueOf("b"));
        assertThrows(IllegalArgumentException.class, () -> vm.valueOf("missing"));
        assertThrows(IllegalStateException.class, vm::run);
    }
}
