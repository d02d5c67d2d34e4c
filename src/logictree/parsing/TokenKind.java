package logictree.parsing;

import java.util.regex.Pattern;

/**
 * Lexical categories, in the order the lexer tries them at each position.
 * The declaration order is the disambiguation policy: keywords are tried
 * before CONST and IDENT, so they win wherever both could match.
 */
public enum TokenKind
{
    COMMENT  ("\\(\\*.*?\\*\\)"),
    ASSIGN   (":="),
    OP_NOT   ("not"),
    OP_AND   ("and"),
    OP_OR    ("or"),
    OP_XOR   ("xor"),
    LPAREN   ("\\("),
    RPAREN   ("\\)"),
    SEMICOLON(";"),
    CONST    ("\\btrue\\b|\\bfalse\\b"),
    HEX      ("\\b[0-9][0-9a-fA-F]*\\b"),
    ROMAN    ("\\b[IVXLCDM]+\\b"),
    IDENT    ("\\b[a-zA-Z_][a-zA-Z_0-9]{0,31}\\b"),
    SKIP     ("[ \\t\\n]+"),
    MISMATCH (".");

    private final Pattern pattern;

    TokenKind(String regex)
    {
        // \b follows Unicode word characters, [a-z] ranges stay ASCII
        pattern = Pattern.compile(regex, Pattern.DOTALL | Pattern.UNICODE_CHARACTER_CLASS);
    }

    Pattern pattern()
    {
        return pattern;
    }

    /** Kinds the lexer drops instead of emitting. */
    public boolean isDiscarded()
    {
        return this == COMMENT || this == SKIP;
    }

    /** Kinds that may stand alone as an operand of an expression. */
    public boolean isOperand()
    {
        return this == IDENT || this == CONST || this == ROMAN || this == HEX;
    }
}
