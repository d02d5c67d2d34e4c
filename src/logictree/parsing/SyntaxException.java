package logictree.parsing;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

public class SyntaxException extends ExpressionException
{
    public static final String END_OF_INPUT = "end of input";

    private final Set<TokenKind> expected;
    private final TokenKind found;
    private final int position;

    /**
     * @param found    kind at the cursor, or {@code null} when the cursor is past the last token
     * @param position token index the parser was looking at
     */
    public SyntaxException(Set<TokenKind> expected, TokenKind found, int position)
    {
        super(describe(expected, found));
        this.expected = Collections.unmodifiableSet(EnumSet.copyOf(expected));
        this.found = found;
        this.position = position;
    }

    public SyntaxException(TokenKind expected, TokenKind found, int position)
    {
        this(EnumSet.of(expected), found, position);
    }

    private static String describe(Set<TokenKind> expected, TokenKind found)
    {
        String actual = found == null ? END_OF_INPUT : found.name();
        if (expected.size() == 1)
            return String.format("Expected %s, found %s", expected.iterator().next(), actual);

        return String.format("Expected an expression (%s), found %s",
                expected.stream().map(Enum::name).collect(Collectors.joining(", ")), actual);
    }

    public Set<TokenKind> getExpected()
    {
        return expected;
    }

    /** @return the kind found, {@code null} at end of input */
    public TokenKind getFound()
    {
        return found;
    }

    public boolean isEndOfInput()
    {
        return found == null;
    }

    public int getPosition()
    {
        return position;
    }

    @Override
    public String getCategory()
    {
        return "SYNTAX";
    }
}
