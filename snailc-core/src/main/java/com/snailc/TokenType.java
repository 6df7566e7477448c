package com.snailc;

public enum TokenType {
    // Literals and names
    NUMBER,
    STRING,
    REGEX,
    IDENTIFIER,
    DOLLAR_NAME,        // $e, $n, $src, ...
    FIELD,              // $0, $1, ...
    SUBPROCESS_CAPTURE, // $( ... )
    SUBPROCESS_STATUS,  // @( ... )
    ACCESSOR,           // $[ ... ]

    // Keywords
    IF, ELIF, ELSE, WHILE, FOR, IN, DEF, CLASS, RETURN, BREAK, CONTINUE, PASS,
    TRY, EXCEPT, FINALLY, RAISE, FROM, WITH, AS, ASSERT, DEL, IMPORT, YIELD, LET,
    AND, OR, NOT, IS, TRUE, FALSE, NONE,

    // Brackets
    LPAREN, RPAREN, LBRACKET, RBRACKET, LBRACE, RBRACE,
    SET_LBRACE,         // #{
    DICT_LBRACE,        // %{

    // Punctuation
    COMMA, DOT, COLON, SEMICOLON, QUESTION, PIPE,

    // Operators
    ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, SLASH_SLASH_ASSIGN,
    PERCENT_ASSIGN, STAR_STAR_ASSIGN,
    PLUS, MINUS, STAR, SLASH, SLASH_SLASH, PERCENT, STAR_STAR,
    INCREMENT, DECREMENT,
    EQ, NE, LT, LE, GT, GE,

    NEWLINE,            // injected statement separator
    EOF
}
