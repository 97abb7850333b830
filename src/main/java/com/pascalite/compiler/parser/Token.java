package com.pascalite.compiler.parser;

public final class Token {
    public final TokenType type;
    public final String lexeme;
    /** Integer, Double or String for literal tokens; null otherwise. */
    public final Object literal;
    public final SourcePosition position;

    public Token(TokenType type, String lexeme, Object literal, SourcePosition position) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.position = position;
    }

    public TokenType.Category category() {
        return type.category;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token other = (Token) o;
        return type == other.type
                && lexeme.equals(other.lexeme)
                && java.util.Objects.equals(literal, other.literal)
                && position.equals(other.position);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(type, lexeme, literal, position);
    }

    @Override
    public String toString() {
        return type + " '" + lexeme + "' @" + position;
    }
}
