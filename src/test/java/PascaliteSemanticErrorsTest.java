import org.junit.jupiter.api.Test;

import com.pascalite.compiler.Pascalite;
import com.pascalite.compiler.codegen.SemanticException;
import com.pascalite.compiler.parser.CompileException;
import com.pascalite.compiler.parser.SourcePosition;

import static org.junit.jupiter.api.Assertions.*;

public class PascaliteSemanticErrorsTest {

    private static SemanticException rejects(String source) {
        return assertThrows(SemanticException.class, () -> new Pascalite().compile(source));
    }

    private static void assertMessageContains(CompileException e, String fragment) {
        assertTrue(e.getMessage().contains(fragment), e.getMessage());
    }

    @Test
    void duplicateVariable_inSameScope() {
        SemanticException e = rejects("var x: integer; x: real; begin end.");
        assertEquals(new SourcePosition(1, 17), e.getPosition());
        assertMessageContains(e, "Duplicate declaration of 'x'");
        assertEquals("Semantic", e.kind());
    }

    @Test
    void duplicate_isCaseInsensitive_andSpansDeclarationKinds() {
        rejects("var Total: integer; const total = 1; begin end.");
        rejects("var a, b, A: integer; begin end.");
        rejects("procedure p; begin end; var p: integer; begin end.");
    }

    @Test
    void innerScope_mayShadowOuterName() {
        assertDoesNotThrow(() -> new Pascalite().compile(
                "var x: integer; procedure p; var x: string; begin x := 'local' end; begin x := 1; p end."));
    }

    @Test
    void localsAreNotVisibleOutsideTheirProcedure() {
        SemanticException e = rejects("procedure p; var t: integer; begin t := 1 end; begin t := 2 end.");
        assertMessageContains(e, "Undeclared identifier 't'");
    }

    @Test
    void undeclaredIdentifier_inExpressionAndAssignment() {
        assertMessageContains(rejects("begin y := 1 end."), "Undeclared identifier 'y'");
        assertMessageContains(rejects("var x: integer; begin x := y + 1 end."), "Undeclared identifier 'y'");
    }

    @Test
    void useBeforeDeclaration_isUndeclared() {
        rejects("procedure p; begin late := 1 end; var late: integer; begin p end.");
    }

    @Test
    void assignmentTypeMismatch() {
        assertMessageContains(rejects("var x: integer; begin x := 'a' end."),
                "cannot assign string to integer variable 'x'");
        assertMessageContains(rejects("var x: integer; begin x := 2.5 end."),
                "cannot assign real to integer variable 'x'");
        rejects("var x: integer; begin x := 4 / 2 end.");
        rejects("var b: boolean; begin b := 1 end.");
    }

    @Test
    void operatorTypeMismatch() {
        assertMessageContains(rejects("var s: string; begin s := 'a' - 'b' end."),
                "cannot apply '-' to string and string");
        rejects("var b: boolean; begin b := 1 and 2 end.");
        rejects("var x: integer; begin x := 7 div 2.0 end.");
        rejects("var b: boolean; begin b := 'a' < 'b' end.");
        rejects("var b: boolean; begin b := true = 1 end.");
        rejects("var b: boolean; begin b := not 3 end.");
        rejects("var x: integer; begin x := -'a' end.");
    }

    @Test
    void conditions_mustBeBoolean() {
        assertMessageContains(rejects("var x: integer; begin if x then x := 1 end."),
                "Condition of 'if' must be boolean, found integer");
        rejects("var x: integer; begin while x + 1 do x := 1 end.");
        rejects("var x: integer; begin repeat x := 1 until x end.");
    }

    @Test
    void forLoop_requiresIntegerCounterAndBounds() {
        rejects("var r: real; begin for r := 1 to 3 do end.");
        rejects("var i: integer; begin for i := 1 to 2.5 do end.");
        rejects("const i = 1; begin for i := 1 to 3 do end.");
    }

    @Test
    void assignmentToConstantOrProcedure() {
        assertMessageContains(rejects("const n = 1; begin n := 2 end."), "Cannot assign to constant 'n'");
        assertMessageContains(rejects("procedure p; begin end; begin p := 2 end."), "Cannot assign to procedure 'p'");
    }

    @Test
    void procedureMisuse() {
        assertMessageContains(rejects("procedure p; begin end; begin p(1) end."), "takes no arguments");
        assertMessageContains(rejects("var x: integer; begin x end."), "'x' is a variable, not a procedure");
        assertMessageContains(rejects("begin launch end."), "Undeclared procedure 'launch'");
        rejects("var x: integer; procedure p; begin end; begin x := p end.");
    }

    @Test
    void builtinArguments() {
        rejects("begin write end.");
        rejects("var x: integer; begin readln(x + 1) end.");
        rejects("const c = 1; begin readln(c) end.");
        rejects("var b: boolean; begin readln(b) end.");
    }

    @Test
    void divisionByLiteralZero() {
        SemanticException e = rejects("var x: integer; begin x := 1 div 0 end.");
        assertMessageContains(e, "Division by zero");
        assertEquals(new SourcePosition(1, 30), e.getPosition());
        rejects("var x: integer; begin x := 5 mod 0 end.");
        rejects("var r: real; begin r := 1 / 0.0 end.");
        rejects("var r: real; begin r := 1 / (0) end.");
    }

    @Test
    void divisionByConstantZero() {
        rejects("const z = 0; var x: integer; begin x := 5 mod z end.");
        assertDoesNotThrow(() -> new Pascalite().compile(
                "const z = 2; var x: integer; begin x := 5 mod z end."));
    }

    @Test
    void divisionByZeroCheck_canBeDisabled() {
        Pascalite engine = new Pascalite();
        engine.setCheckDivisionByZero(false);
        assertDoesNotThrow(() -> engine.compile("var x: integer; begin x := 1 div 0 end."));
        assertFalse(engine.isCheckDivisionByZero());
    }

    @Test
    void semanticErrors_comeFromTheFirstOffendingStatement() {
        SemanticException e = rejects("var x: integer;\nbegin\n  x := 1;\n  x := 'two';\n  y := 3\nend.");
        assertEquals(4, e.getPosition().line);
    }
}
