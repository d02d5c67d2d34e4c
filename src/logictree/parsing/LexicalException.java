package logictree.parsing;

public class LexicalException extends ExpressionException
{
    private final String lexeme;
    private final int offset;

    public LexicalException(String lexeme, int offset)
    {
        super(String.format("Lexical error: unexpected '%s' at offset %d", lexeme, offset));
        this.lexeme = lexeme;
        this.offset = offset;
    }

    public String getLexeme()
    {
        return lexeme;
    }

    public int getOffset()
    {
        return offset;
    }

    @Override
    public String getCategory()
    {
        return "LEXICAL";
    }
}
