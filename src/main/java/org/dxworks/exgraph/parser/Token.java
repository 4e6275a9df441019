package org.dxworks.exgraph.parser;

import java.util.List;

final class Token {
    final TokenType type;
    final String text;
    final int line;
    final int column;
    /** Whitespace (not a newline) directly precedes this token. */
    final boolean spaceBefore;
    /** Source of each {@code #{...}} fragment of a string, with the line it starts on. */
    final List<Interpolation> interpolations;

    Token(TokenType type, String text, int line, int column, boolean spaceBefore, List<Interpolation> interpolations) {
        this.type = type;
        this.text = text;
        this.line = line;
        this.column = column;
        this.spaceBefore = spaceBefore;
        this.interpolations = interpolations == null ? List.of() : interpolations;
    }

    boolean is(TokenType expected) {
        return type == expected;
    }

    boolean isOperator(String op) {
        return type == TokenType.OPERATOR && text.equals(op);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + line + ":" + column;
    }

    static final class Interpolation {
        final String source;
        final int line;
        final int column;

        Interpolation(String source, int line, int column) {
            this.source = source;
            this.line = line;
            this.column = column;
        }
    }
}
