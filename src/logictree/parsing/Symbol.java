package logictree.parsing;

/** Non-terminals of the grammar, with the letters the tree is displayed with. */
public enum Symbol
{
    STATEMENT("S"),
    DISJUNCTION("F"),
    CONJUNCTION("T"),
    ATOM("E"),
    OPERAND("a");

    private final String label;

    Symbol(String label)
    {
        this.label = label;
    }

    public String getLabel()
    {
        return label;
    }
}
