package logictree.parsing;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A parse tree node: either a non-terminal carrying a {@link Symbol} and its
 * children, or a leaf carrying the token it was built from.
 */
public final class Node
{
    private final Symbol symbol;
    private final Token token;
    private final List<Node> children;
    private final int height;

    private Node(Symbol symbol, Token token, List<Node> children)
    {
        this.symbol = symbol;
        this.token = token;
        this.children = children;

        int h = 0;
        for (Node child : children)
            h = Math.max(h, child.height);
        this.height = h + 1;
    }

    public static Node leaf(Token token)
    {
        return new Node(null, Objects.requireNonNull(token, "token"), Collections.emptyList());
    }

    public static Node of(Symbol symbol, Node... children)
    {
        Objects.requireNonNull(symbol, "symbol");
        return new Node(symbol, null, Collections.unmodifiableList(new ArrayList<>(Arrays.asList(children))));
    }

    public boolean isLeaf()
    {
        return token != null;
    }

    /** @return the grammar symbol, {@code null} for leaves */
    public Symbol getSymbol()
    {
        return symbol;
    }

    /** @return the wrapped token, {@code null} for non-terminals */
    public Token getToken()
    {
        return token;
    }

    public String getLabel()
    {
        return isLeaf() ? token.getText() : symbol.getLabel();
    }

    /** Levels from this node down to its deepest leaf, 1 for a leaf. */
    public int getHeight()
    {
        return height;
    }

    public List<Node> getChildren()
    {
        return children;
    }

    public Node getChild(int index)
    {
        return children.get(index);
    }

    /** Leaves below this node, left to right. */
    public List<Token> getTokens()
    {
        List<Token> tokens = new ArrayList<>();
        collectTokens(this, tokens);
        return tokens;
    }

    private static void collectTokens(Node node, List<Token> out)
    {
        if (node.isLeaf())
            out.add(node.token);
        else
            for (Node child : node.children)
                collectTokens(child, out);
    }

    public JSONObject toJSON()
    {
        JSONObject obj = new JSONObject();
        obj.put("label", getLabel());
        if (isLeaf())
            obj.put("token", token.toJSON());
        else
        {
            obj.put("symbol", symbol.name());
            JSONArray arr = new JSONArray();
            for (Node child : children)
                arr.put(child.toJSON());
            obj.put("children", arr);
        }
        return obj;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof Node))
            return false;

        Node other = (Node) o;
        return symbol == other.symbol && Objects.equals(token, other.token) && children.equals(other.children);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(symbol, token, children);
    }

    /** Bracketed one-line form, e.g. {@code S[a[x] := E[a[y]] ;]}. */
    @Override
    public String toString()
    {
        if (isLeaf())
            return token.getText();

        StringBuilder sb = new StringBuilder(symbol.getLabel()).append('[');
        for (int i = 0; i < children.size(); i++)
        {
            if (i > 0)
                sb.append(' ');
            sb.append(children.get(i));
        }
        return sb.append(']').toString();
    }
}
