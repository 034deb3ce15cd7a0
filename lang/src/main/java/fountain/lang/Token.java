package fountain.lang;

import lombok.NonNull;

record Token(
    @NonNull Type type,
    @NonNull String lexeme,
    int line,
    int column) {

    @Override
    public String toString() {
        return "(Token " + type + " \"" + lexeme + "\" " + line + ":" + column + ")";
    }

    enum Type {
        BRACE_LEFT,
        BRACE_RIGHT,
        BRACKET_LEFT,
        BRACKET_RIGHT,
        COMMA,
        DOT,
        PAREN_LEFT,
        PAREN_RIGHT,
        SEMICOLON,

        // operators
        BANG_EQUAL,
        EQUAL,
        EQUAL_EQUAL,
        GREATER,
        GREATER_EQUAL,
        LESS,
        LESS_EQUAL,
        MINUS,
        MINUS_EQUAL,
        PLUS,
        PLUS_EQUAL,
        SLASH,
        SLASH_EQUAL,
        STAR,
        STAR_EQUAL,

        // literals
        IDENTIFIER,
        NUMBER,
        STRING,

        // keywords
        AND,
        ASSERT,
        BREAK,
        CONTINUE,
        DO,
        ELSE,
        END,
        FALSE,
        FN,
        FOR,
        IF,
        NIL,
        NOT,
        OR,
        PRINT,
        RETURN,
        TRUE,

        // end-of-file
        EOF;
    }
}
