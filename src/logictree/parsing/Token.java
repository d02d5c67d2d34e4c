package logictree.parsing;

import org.json.JSONObject;

import java.util.Objects;

public final class Token
{
    private final TokenKind kind;
    private final String text;
    private final int offset;

    public Token(TokenKind kind, String text, int offset)
    {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text");
        this.offset = offset;
    }

    public TokenKind getKind()
    {
        return kind;
    }

    public String getText()
    {
        return text;
    }

    /** Character index of the lexeme in the source text. */
    public int getOffset()
    {
        return offset;
    }

    public JSONObject toJSON()
    {
        JSONObject obj = new JSONObject();
        obj.put("type", kind.name());
        obj.put("value", text);
        obj.put("offset", offset);
        return obj;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof Token))
            return false;

        Token other = (Token) o;
        return kind == other.kind && offset == other.offset && text.equals(other.text);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(kind, text, offset);
    }

    @Override
    public String toString()
    {
        return String.format("%s(%s)", kind, text);
    }
}
