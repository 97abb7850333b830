package com.pascalite.compiler.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;

import com.pascalite.debug.Debug;

/**
 * Turns Pascal source into tokens on demand.
 *
 * Each call to {@link #iterator()} starts a fresh scan from the first
 * character, so the same lexer can be walked any number of times. The
 * sequence always ends with a single {@link TokenType#EOF} token.
 */
public class Lexer implements Iterable<Token> {
    private static final String TAG = "pascalite.lexer";

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        for (TokenType type : TokenType.values()) {
            if (type.category == TokenType.Category.KEYWORD) map.put(type.spelling, type);
        }
        keywords = Collections.unmodifiableMap(map);
    }

    private final String source;

    public Lexer(String source) {
        this.source = source;
    }

    public static boolean isReserved(String word) {
        return keywords.containsKey(word.toLowerCase(Locale.ROOT));
    }

    @Override
    public Iterator<Token> iterator() {
        return new Scan();
    }

    /** Drains a full scan into a list; ends with EOF. */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        for (Token token : this) tokens.add(token);
        Debug.get().d(TAG, "scanned " + tokens.size() + " tokens");
        return tokens;
    }

    private final class Scan implements Iterator<Token> {
        private int start = 0;
        private int current = 0;
        private int line = 1;
        private int lineStart = 0;
        private int startLine = 1;
        private int startColumn = 1;
        private boolean done = false;

        @Override
        public boolean hasNext() {
            return !done;
        }

        @Override
        public Token next() {
            if (done) throw new NoSuchElementException();
            Token token = scanToken();
            if (token.type == TokenType.EOF) done = true;
            Debug.get().t(TAG, token.toString());
            return token;
        }

        private Token scanToken() {
            skipWhitespaceAndComments();
            markStart();
            if (isAtEnd()) return make(TokenType.EOF, null);

            char c = advance();
            switch (c) {
                case '(': return make(TokenType.LEFT_PAREN);
                case ')': return make(TokenType.RIGHT_PAREN);
                case ';': return make(TokenType.SEMICOLON);
                case ',': return make(TokenType.COMMA);
                case '.': return make(TokenType.DOT);
                case '+': return make(TokenType.PLUS);
                case '-': return make(TokenType.MINUS);
                case '*': return make(TokenType.STAR);
                case '/': return make(TokenType.SLASH);
                case '=': return make(TokenType.EQUAL);
                case ':': return make(match('=') ? TokenType.ASSIGN : TokenType.COLON);
                case '>': return make(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
                case '<':
                    if (match('=')) return make(TokenType.LESS_EQUAL);
                    if (match('>')) return make(TokenType.NOT_EQUAL);
                    return make(TokenType.LESS);
                case '\'':
                    return string();
                default:
                    if (isDigit(c)) return number();
                    if (isAlpha(c)) return identifier();
                    throw error(c, "Unexpected character: '" + c + "'");
            }
        }

        private void skipWhitespaceAndComments() {
            while (!isAtEnd()) {
                char c = peek();
                if (c == ' ' || c == '\r' || c == '\t') {
                    advance();
                } else if (c == '\n') {
                    advance();
                    newLine();
                } else if (c == '{') {
                    markStart();
                    advance();
                    skipComment("}");
                } else if (c == '(' && peekNext() == '*') {
                    markStart();
                    advance();
                    advance();
                    skipComment("*)");
                } else if (c == '/' && peekNext() == '/') {
                    while (!isAtEnd() && peek() != '\n') advance();
                } else {
                    return;
                }
            }
        }

        private void skipComment(String terminator) {
            while (!source.startsWith(terminator, current)) {
                if (isAtEnd()) throw errorAtStart(source.charAt(start), "Unterminated comment");
                if (advance() == '\n') newLine();
            }
            current += terminator.length();
        }

        private Token identifier() {
            while (isAlphaNumeric(peek())) advance();
            String text = source.substring(start, current);
            TokenType type = keywords.getOrDefault(text.toLowerCase(Locale.ROOT), TokenType.IDENTIFIER);
            return make(type);
        }

        private Token number() {
            while (isDigit(peek())) advance();
            boolean real = false;
            if (peek() == '.' && isDigit(peekNext())) {
                real = true;
                advance();
                while (isDigit(peek())) advance();
            }
            if ((peek() == 'e' || peek() == 'E') && exponentFollows()) {
                real = true;
                advance();
                if (peek() == '+' || peek() == '-') advance();
                while (isDigit(peek())) advance();
            }
            String text = source.substring(start, current);
            if (real) {
                double value = Double.parseDouble(text);
                if (Double.isInfinite(value)) throw errorAtStart(text.charAt(0), "Real literal out of range: " + text);
                return make(TokenType.REAL_LITERAL, value);
            }
            try {
                return make(TokenType.INTEGER_LITERAL, Integer.parseInt(text));
            } catch (NumberFormatException e) {
                throw errorAtStart(text.charAt(0), "Integer literal out of range: " + text);
            }
        }

        private boolean exponentFollows() {
            int i = current + 1;
            if (i < source.length() && (source.charAt(i) == '+' || source.charAt(i) == '-')) i++;
            return i < source.length() && isDigit(source.charAt(i));
        }

        private Token string() {
            StringBuilder value = new StringBuilder();
            while (true) {
                if (isAtEnd() || peek() == '\n') throw errorAtStart('\'', "Unterminated string");
                char c = advance();
                if (c == '\'') {
                    if (peek() != '\'') break;
                    advance();
                }
                value.append(c);
            }
            return make(TokenType.STRING_LITERAL, value.toString());
        }

        private void markStart() {
            start = current;
            startLine = line;
            startColumn = current - lineStart + 1;
        }

        private void newLine() {
            line++;
            lineStart = current;
        }

        private boolean isAtEnd() { return current >= source.length(); }
        private char advance() { return source.charAt(current++); }

        private boolean match(char expected) {
            if (isAtEnd()) return false;
            if (source.charAt(current) != expected) return false;
            current++;
            return true;
        }

        private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
        private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

        private Token make(TokenType type) { return make(type, null); }
        private Token make(TokenType type, Object literal) {
            String text = source.substring(start, current);
            return new Token(type, text, literal, new SourcePosition(startLine, startColumn));
        }

        /** Error at the character just consumed. */
        private LexicalException error(char c, String msg) {
            int column = (current - 1) - lineStart + 1;
            return new LexicalException(new SourcePosition(line, column), c, msg);
        }

        /** Error at the start of the token or comment being scanned. */
        private LexicalException errorAtStart(char c, String msg) {
            return new LexicalException(new SourcePosition(startLine, startColumn), c, msg);
        }
    }

    private static boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
