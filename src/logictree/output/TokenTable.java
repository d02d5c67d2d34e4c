package logictree.output;

import logictree.parsing.Token;
import org.json.JSONArray;

import java.util.List;

public final class TokenTable
{
    public static final String HEADING = "Token table:";
    public static final String RULE = "================";

    private TokenTable() {}

    public static String render(List<Token> tokens)
    {
        StringBuilder sb = new StringBuilder();
        sb.append(HEADING).append('\n').append(RULE).append('\n');
        for (Token t : tokens)
            sb.append(t.getKind()).append(": ").append(t.getText()).append('\n');
        return sb.toString();
    }

    public static JSONArray toJSON(List<Token> tokens)
    {
        JSONArray arr = new JSONArray();
        tokens.forEach(t -> arr.put(t.toJSON()));
        return arr;
    }
}
