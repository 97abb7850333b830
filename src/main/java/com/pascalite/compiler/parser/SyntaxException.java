package com.pascalite.compiler.parser;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

public final class SyntaxException extends CompileException {
    private final Set<TokenType> expected;
    private final Token found;

    public SyntaxException(Set<TokenType> expected, Token found) {
        super(found.position, message(expected, found));
        this.expected = Collections.unmodifiableSet(expected.isEmpty()
                ? EnumSet.noneOf(TokenType.class) : EnumSet.copyOf(expected));
        this.found = found;
    }

    public Set<TokenType> getExpected() {
        return expected;
    }

    public Token getFound() {
        return found;
    }

    @Override
    public String kind() {
        return "Syntax";
    }

    private static String message(Set<TokenType> expected, Token found) {
        String want = expected.stream()
                .sorted()
                .map(TokenType::describe)
                .collect(Collectors.joining(", "));
        String got = (found.type == TokenType.EOF) ? "end of input" : "'" + found.lexeme + "'";
        return "Expected " + (expected.size() > 1 ? "one of " : "") + want + " but found " + got + ".";
    }
}
