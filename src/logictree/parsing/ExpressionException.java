package logictree.parsing;

/**
 * Base for every failure raised while turning source text into a tree.
 * Both kinds are terminal for the attempt that raised them.
 */
public abstract class ExpressionException extends RuntimeException
{
    protected ExpressionException(String message)
    {
        super(message);
    }

    /** Short category name, used in reports and in service replies. */
    public abstract String getCategory();
}
