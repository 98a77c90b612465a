package com.pinery.core.dsl;

/**
 * Token types for the Pine Script lexer
 */
public enum TokenType {
    // Words
    KEYWORD,        // var, varip, if, else, for, while, switch, type, method, int, float, ...
    IDENTIFIER,     // user names, plot, nz, input
    NAMESPACE,      // ta, math, strategy, array, ... (when followed by '.')
    BUILTIN,        // close, open, high, low, volume, hl2, bar_index, ...

    // Literals
    NUMBER,         // 14, 1.5, .5, 1e5
    STRING,         // "text", 'text'
    BOOLEAN,        // true, false, na
    LITERAL,        // #ff0000 color literals

    // Operators
    OPERATOR,       // := => == != <= >= += -= *= /= %= < > + - * / % = ? :

    // Punctuation
    LPAREN,         // (
    RPAREN,         // )
    LBRACKET,       // [
    RBRACKET,       // ]
    COMMA,          // ,
    DOT,            // .

    // Layout
    COMMENT,        // // line and /* block */ comments
    NEWLINE,        // end of a logical line
    INDENT,         // indentation increased
    DEDENT,         // indentation decreased

    // Anything the lexer does not recognize
    UNKNOWN,

    // End of input
    EOF
}
