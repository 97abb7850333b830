import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pascalite.compiler.Pascalite;
import com.pascalite.compiler.parser.DataType;
import com.pascalite.compiler.vm.Instruction;
import com.pascalite.compiler.vm.Opcode;
import com.pascalite.compiler.vm.ProgramFormatException;
import com.pascalite.compiler.vm.ProgramJsonFormat;
import com.pascalite.compiler.vm.ProgramTextFormat;
import com.pascalite.compiler.vm.Slot;
import com.pascalite.compiler.vm.VmProgram;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PascaliteProgramFormatTest {

    private static final String RICH =
            "program rich;\n" +
            "const msg = 'say \"hi\" \\ now';\n" +
            "var i: integer; r: real; s: string; f: boolean;\n" +
            "procedure bump; begin i := i + 1 end;\n" +
            "begin\n" +
            "  r := 1.0E-7 * 3;\n" +
            "  s := msg + '''';\n" +
            "  f := r >= 0.5;\n" +
            "  while i < 3 do bump;\n" +
            "  if f then writeln(s) else writeln(r, i)\n" +
            "end.";

    @Test
    void text_exampleListing() {
        String text = new Pascalite().compileToText("var x: integer; begin x := 2 + 3; end.");
        assertEquals(
                ".program main\n" +
                ".slot 0 x integer\n" +
                "START\n" +
                "PUSHI 2\n" +
                "PUSHI 3\n" +
                "ADD\n" +
                "STOREG 0\n" +
                "STOP\n", text);
    }

    @Test
    void text_readsBackEqualProgram() {
        VmProgram p = new Pascalite().compile(RICH);
        VmProgram back = ProgramTextFormat.read(ProgramTextFormat.write(p));
        assertEquals(p, back);
        assertEquals("rich", back.name());
    }

    @Test
    void json_readsBackEqualProgram() {
        VmProgram p = new Pascalite().compile(RICH);
        assertEquals(p, ProgramJsonFormat.read(ProgramJsonFormat.write(p)));
    }

    @Test
    void text_stringOperandsAreEscaped() {
        Instruction in = Instruction.of(Opcode.PUSHS, "a\"b\\c\n\t");
        assertEquals("PUSHS \"a\\\"b\\\\c\\n\\t\"", in.toString());
        assertEquals("PUSHF 2.5", Instruction.of(Opcode.PUSHF, 2.5).toString());
        assertEquals("JZ 7", Instruction.of(Opcode.JZ, 7).toString());
    }

    @Test
    void text_ignoresCommentsAndBlankLines() {
        String text = "; compiled by hand\n" +
                "\n" +
                ".program hand\n" +
                ".slot 0 s string\n" +
                "START\n" +
                "  ; greet\n" +
                "PUSHS \"semi; colon\"\n" +
                "STOREG 0\n" +
                "STOP\n";
        VmProgram p = ProgramTextFormat.read(text);
        assertEquals(4, p.code().size());
        assertEquals("semi; colon", p.code().get(1).stringOperand());
        assertEquals(List.of(new Slot(0, "s", DataType.STRING)), p.slots());
    }

    @Test
    void text_malformedInput() {
        assertThrows(ProgramFormatException.class, () -> ProgramTextFormat.read("START\nSTOP\n"));
        assertThrows(ProgramFormatException.class, () -> ProgramTextFormat.read(".program p\nFLY\n"));
        assertThrows(ProgramFormatException.class, () -> ProgramTextFormat.read(".program p\nPUSHI\n"));
        assertThrows(ProgramFormatException.class, () -> ProgramTextFormat.read(".program p\nADD 3\n"));
        assertThrows(ProgramFormatException.class, () -> ProgramTextFormat.read(".program p\nPUSHI two\n"));
        assertThrows(ProgramFormatException.class, () -> ProgramTextFormat.read(".program p\nPUSHS unquoted\n"));
        assertThrows(ProgramFormatException.class, () -> ProgramTextFormat.read(".program p\nJUMP 4\n"));
        assertThrows(ProgramFormatException.class, () -> ProgramTextFormat.read(".program p\n.slot 0 x decimal\n"));
        ProgramFormatException e = assertThrows(ProgramFormatException.class,
                () -> ProgramTextFormat.read(".program p\nSTART\nPOPALL\n"));
        assertTrue(e.getMessage().startsWith("line 3:"), e.getMessage());
    }

    @Test
    void json_layout() throws Exception {
        String json = new Pascalite().compileToJson("var x: integer; begin x := 2 + 3; end.");
        JsonNode root = new ObjectMapper().readTree(json);
        assertEquals("main", root.get("program").asText());
        assertEquals("x", root.get("slots").get(0).get("name").asText());
        assertEquals("integer", root.get("slots").get(0).get("type").asText());
        assertEquals("PUSHI", root.get("code").get(1).get("op").asText());
        assertEquals(2, root.get("code").get(1).get("arg").asInt());
        assertFalse(root.get("code").get(0).has("arg"));
        assertEquals(6, root.get("code").size());
    }

    @Test
    void json_malformedInput() {
        assertThrows(ProgramFormatException.class, () -> ProgramJsonFormat.read("{not json"));
        assertThrows(ProgramFormatException.class, () -> ProgramJsonFormat.read("[]"));
        assertThrows(ProgramFormatException.class, () -> ProgramJsonFormat.read("{\"code\": []}"));
        assertThrows(ProgramFormatException.class,
                () -> ProgramJsonFormat.read("{\"program\": \"p\", \"code\": [{\"op\": \"PUSHI\", \"arg\": \"x\"}]}"));
        assertThrows(ProgramFormatException.class,
                () -> ProgramJsonFormat.read("{\"program\": \"p\", \"code\": [{\"op\": \"JUMP\", \"arg\": 9}]}"));
    }

    @Test
    void compiledReals_readBackFromJson() {
        VmProgram p = new Pascalite().compile("var r: real; begin r := 1e300; r := -r / 3 end.");
        assertEquals(p, ProgramJsonFormat.read(ProgramJsonFormat.write(p)));
    }
}
