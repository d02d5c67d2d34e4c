package logictree.parsing;

/**
 * Raised when a statement nests deeper than {@link Parser#MAX_DEPTH}. The
 * statement may be grammatical; it is refused so that parsing and every walk
 * over the tree stay within the thread's stack.
 */
public class NestingTooDeepException extends ExpressionException
{
    private final int limit;
    private final int position;

    public NestingTooDeepException(int limit, int position)
    {
        super(String.format("Expression nested deeper than %d levels at token %d", limit, position));
        this.limit = limit;
        this.position = position;
    }

    public int getLimit()
    {
        return limit;
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
