package org.dxworks.exgraph.parser;

enum TokenType {
    IDENTIFIER,
    ALIAS,
    ATOM,
    KW_KEY,
    INTEGER,
    FLOAT,
    CHAR,
    STRING,
    CHARLIST,
    SIGIL,
    RESERVED_LITERAL,
    DO,
    END,
    FN,
    BLOCK_KEYWORD,
    OPERATOR,
    ARROW,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    LBRACE,
    RBRACE,
    PERCENT,
    BITSTRING_OPEN,
    BITSTRING_CLOSE,
    COMMA,
    DOT,
    NEWLINE,
    EOF
}
