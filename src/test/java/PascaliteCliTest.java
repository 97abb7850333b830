import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.pascalite.compiler.PascaliteCli;
import com.pascalite.compiler.vm.ProgramJsonFormat;
import com.pascalite.compiler.vm.ProgramTextFormat;
import com.pascalite.compiler.vm.VmProgram;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class PascaliteCliTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int cli(String stdin, String... args) {
        return PascaliteCli.run(args,
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private Path program(String fileName) throws IOException {
        Path p = dir.resolve(fileName);
        Files.writeString(p, PascaliteExecutionTest.resource(fileName), StandardCharsets.UTF_8);
        return p;
    }

    @Test
    void compile_writesTextListingNextToSource() throws IOException {
        Path src = program("swap.pas");
        assertEquals(0, cli("", "compile", src.toString()));

        Path listing = dir.resolve("swap.vm");
        assertTrue(Files.exists(listing));
        VmProgram p = ProgramTextFormat.read(Files.readString(listing, StandardCharsets.UTF_8));
        assertEquals("swap", p.name());
        assertNotNull(p.slot("exchange.tmp"));
        assertTrue(stdout().contains("swap.vm"), stdout());
    }

    @Test
    void compile_jsonToExplicitOutput() throws IOException {
        Path src = program("loops.pas");
        Path target = dir.resolve("out.json");
        assertEquals(0, cli("", "compile", src.toString(), "--format=json", "--out=" + target));
        VmProgram p = ProgramJsonFormat.read(Files.readString(target, StandardCharsets.UTF_8));
        assertEquals("loops", p.name());
    }

    @Test
    void compile_syntaxErrorExitsOneWithPosition() throws IOException {
        Path src = program("broken.pas");
        assertEquals(1, cli("", "compile", src.toString()));
        assertTrue(stderr().startsWith("Syntax error: [line "), stderr());
        assertFalse(Files.exists(dir.resolve("broken.vm")));
    }

    @Test
    void compile_semanticErrorExitsOne() throws IOException {
        Path src = program("mistyped.pas");
        assertEquals(1, cli("", "compile", src.toString()));
        assertTrue(stderr().contains("Semantic error: [line 5:5]"), stderr());
    }

    @Test
    void visualize_printsTree() throws IOException {
        Path src = program("swap.pas");
        assertEquals(0, cli("", "visualize", src.toString()));
        assertTrue(stdout().startsWith("Program swap\n  Block\n    VariableDeclaration a, b : integer\n"), stdout());
    }

    @Test
    void visualize_json() throws IOException {
        Path src = program("swap.pas");
        assertEquals(0, cli("", "visualize", src.toString(), "--format=json"));
        assertTrue(stdout().contains("\"node\" : \"ProcedureDeclaration\""), stdout());
    }

    @Test
    void run_usesStdinAndStdout() throws IOException {
        Path src = program("greet.pas");
        assertEquals(0, cli("ann\n1\n3\n", "run", src.toString()));
        assertEquals("hi ann 2 1.5\n", stdout());
    }

    @Test
    void run_runtimeErrorExitsOne() throws IOException {
        Path src = dir.resolve("zero.pas");
        Files.writeString(src, "var z: integer; begin writeln('before'); writeln(1 div z) end.", StandardCharsets.UTF_8);
        assertEquals(1, cli("", "run", src.toString()));
        assertEquals("before\n", stdout());
        assertTrue(stderr().startsWith("Runtime error: [pc "), stderr());
    }

    @Test
    void usageErrors_exitTwo() {
        assertEquals(2, cli(""));
        assertEquals(2, cli("", "compile"));
        assertEquals(2, cli("", "explode", "x.pas"));
        assertEquals(2, cli("", "compile", "x.pas", "--format=xml"));
        assertTrue(stderr().contains("Usage:"), stderr());
    }

    @Test
    void unreadableSource_exitsThree() {
        assertEquals(3, cli("", "compile", dir.resolve("missing.pas").toString()));
        assertTrue(stderr().contains("Failed to read source file"), stderr());
    }

    @Test
    void unwritableOutput_exitsThree() throws IOException {
        Path src = program("swap.pas");
        Path target = dir.resolve("no-such-dir").resolve("swap.vm");
        assertEquals(3, cli("", "compile", src.toString(), "--out=" + target));
    }

    @Test
    void verbose_logsStagesToStderr() throws IOException {
        Path src = program("swap.pas");
        assertEquals(0, cli("", "compile", src.toString(), "--verbose"));
        assertTrue(stderr().contains("[DEBUG] pascalite.parser: parsed program swap"), stderr());
        assertTrue(stderr().contains("pascalite.codegen"), stderr());
    }
}
