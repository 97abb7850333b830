import org.junit.jupiter.api.Test;

import com.pascalite.compiler.parser.Lexer;
import com.pascalite.compiler.parser.LexicalException;
import com.pascalite.compiler.parser.SourcePosition;
import com.pascalite.compiler.parser.Token;
import com.pascalite.compiler.parser.TokenType;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PascaliteLexerTest {

    private static List<TokenType> types(String source) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : new Lexer(source).tokenize()) out.add(t.type);
        return out;
    }

    @Test
    void assignment_tokensAndEof() {
        assertEquals(
                List.of(TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.REAL_LITERAL, TokenType.SEMICOLON, TokenType.EOF),
                types("x := 3.14;"));
    }

    @Test
    void keywords_areCaseInsensitive_identifiersKeepSpelling() {
        List<Token> tokens = new Lexer("BEGIN Counter End").tokenize();
        assertEquals(TokenType.BEGIN, tokens.get(0).type);
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).type);
        assertEquals("Counter", tokens.get(1).lexeme);
        assertEquals(TokenType.END, tokens.get(2).type);
        assertTrue(Lexer.isReserved("DownTo"));
        assertFalse(Lexer.isReserved("writeln"));
    }

    @Test
    void operators_longestMatch() {
        assertEquals(
                List.of(TokenType.LESS_EQUAL, TokenType.NOT_EQUAL, TokenType.GREATER_EQUAL, TokenType.LESS,
                        TokenType.GREATER, TokenType.COLON, TokenType.ASSIGN, TokenType.EQUAL, TokenType.EOF),
                types("<= <> >= < > : := ="));
    }

    @Test
    void categories_followTokenType() {
        List<Token> tokens = new Lexer("if x + 1 ; 'a' 2.0").tokenize();
        assertEquals(TokenType.Category.KEYWORD, tokens.get(0).category());
        assertEquals(TokenType.Category.IDENTIFIER, tokens.get(1).category());
        assertEquals(TokenType.Category.OPERATOR, tokens.get(2).category());
        assertEquals(TokenType.Category.INTEGER_LITERAL, tokens.get(3).category());
        assertEquals(TokenType.Category.PUNCTUATION, tokens.get(4).category());
        assertEquals(TokenType.Category.STRING_LITERAL, tokens.get(5).category());
        assertEquals(TokenType.Category.REAL_LITERAL, tokens.get(6).category());
        assertEquals(TokenType.Category.END_OF_INPUT, tokens.get(7).category());
    }

    @Test
    void numbers_integerRealAndExponent() {
        List<Token> tokens = new Lexer("42 2.5E-1 1e3 7.25").tokenize();
        assertEquals(42, tokens.get(0).literal);
        assertEquals(0.25, (double) tokens.get(1).literal, 1e-12);
        assertEquals(TokenType.REAL_LITERAL, tokens.get(2).type);
        assertEquals(1000.0, (double) tokens.get(2).literal, 1e-12);
        assertEquals(7.25, (double) tokens.get(3).literal, 1e-12);
    }

    @Test
    void integerFollowedByDot_isNotReal() {
        assertEquals(List.of(TokenType.INTEGER_LITERAL, TokenType.DOT, TokenType.IDENTIFIER, TokenType.EOF),
                types("3.x"));
        assertEquals(List.of(TokenType.END, TokenType.DOT, TokenType.EOF), types("end."));
    }

    @Test
    void integerOverflow_isLexicalError() {
        LexicalException e = assertThrows(LexicalException.class, () -> new Lexer("x := 2147483648").tokenize());
        assertEquals(new SourcePosition(1, 6), e.getPosition());
        assertEquals(2147483647, new Lexer("2147483647").tokenize().get(0).literal);
    }

    @Test
    void realOverflow_isLexicalError() {
        LexicalException e = assertThrows(LexicalException.class, () -> new Lexer("r := 1e400").tokenize());
        assertEquals(new SourcePosition(1, 6), e.getPosition());
        assertTrue(e.getMessage().contains("Real literal out of range"), e.getMessage());
        assertEquals(1e300, (double) new Lexer("1e300").tokenize().get(0).literal, 0.0);
    }

    @Test
    void strings_doubledQuoteEscape() {
        Token t = new Lexer("'it''s'").tokenize().get(0);
        assertEquals(TokenType.STRING_LITERAL, t.type);
        assertEquals("it's", t.literal);
        assertEquals("'it''s'", t.lexeme);
        assertEquals("", new Lexer("''").tokenize().get(0).literal);
    }

    @Test
    void unterminatedString_isLexicalError() {
        LexicalException e = assertThrows(LexicalException.class, () -> new Lexer("x := 'abc\n'").tokenize());
        assertEquals(new SourcePosition(1, 6), e.getPosition());
        assertEquals("Lexical", e.kind());
    }

    @Test
    void comments_areSkipped_positionsTracked() {
        List<Token> tokens = new Lexer("{ one } (* two\n three *) // four\n  x").tokenize();
        assertEquals(2, tokens.size());
        assertEquals(TokenType.IDENTIFIER, tokens.get(0).type);
        assertEquals(new SourcePosition(3, 3), tokens.get(0).position);
    }

    @Test
    void unterminatedComment_reportedAtCommentStart() {
        LexicalException e = assertThrows(LexicalException.class, () -> new Lexer("x\n  (* open").tokenize());
        assertEquals(new SourcePosition(2, 3), e.getPosition());
    }

    @Test
    void unexpectedCharacter_carriesCharacterAndPosition() {
        LexicalException e = assertThrows(LexicalException.class, () -> new Lexer("x := 1 # 2").tokenize());
        assertEquals('#', e.getOffending());
        assertEquals(new SourcePosition(1, 8), e.getPosition());
        assertTrue(e.getMessage().startsWith("[line 1:8]"), e.getMessage());
    }

    @Test
    void scanningIsLazy_tokensBeforeErrorAreDelivered() {
        Iterator<Token> it = new Lexer("a b $").iterator();
        assertEquals("a", it.next().lexeme);
        assertEquals("b", it.next().lexeme);
        assertThrows(LexicalException.class, it::next);
    }

    @Test
    void lexerIsRestartable() {
        Lexer lexer = new Lexer("program p; begin writeln('x') end.");
        List<Token> first = lexer.tokenize();
        List<Token> second = lexer.tokenize();
        assertEquals(first, second);

        Iterator<Token> it = lexer.iterator();
        assertEquals(TokenType.PROGRAM, it.next().type);
    }

    @Test
    void emptySource_yieldsOnlyEof() {
        List<Token> tokens = new Lexer("  \n ").tokenize();
        assertEquals(1, tokens.size());
        assertEquals(TokenType.EOF, tokens.get(0).type);
        assertEquals(new SourcePosition(2, 2), tokens.get(0).position);
    }
}
