package logictree.ws;

import logictree.output.TokenTable;
import logictree.output.TreeRenderer;
import logictree.parsing.ExpressionException;
import logictree.parsing.Lexer;
import logictree.parsing.Node;
import logictree.parsing.Parser;
import logictree.parsing.Token;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.List;

/**
 * Turns one client request into the reply content. Holds no connection state,
 * so it is shared by every connection.
 */
public final class ParseRequests
{
    public static final String PARSE = "PARSE";
    public static final String TOKENIZE = "TOKENIZE";
    public static final String SET_OPTIONS = "SET_OPTIONS";

    private ParseRequests() {}

    /**
     * @param request the {@code "Message"} object sent by the client
     * @param render  whether the client asked for the text tree as well
     * @return reply content, {@code null} when the request needs no reply
     */
    public static JSONObject handle(JSONObject request, boolean render)
    {
        String type = request.optString("type", "");

        switch (type)
        {
            case PARSE:
            case TOKENIZE:
                if (!request.has("text"))
                    return error("REQUEST", type + " needs a \"text\" field");
                try
                {
                    return PARSE.equals(type) ? parse(request.getString("text"), render) : tokenize(request.getString("text"));
                }
                catch (ExpressionException e)
                {
                    return error(e.getCategory(), e.getMessage());
                }
                catch (JSONException e)
                {
                    return error("REQUEST", e.getMessage());
                }
            case SET_OPTIONS:
                return null;
            default:
                return error("REQUEST", "Unknown message type \"" + type + "\"");
        }
    }

    private static JSONObject tokenize(String text)
    {
        JSONObject content = newContent("TOKENS");
        content.put("tokens", TokenTable.toJSON(Lexer.tokenize(text)));
        return content;
    }

    private static JSONObject parse(String text, boolean render)
    {
        List<Token> tokens = Lexer.tokenize(text);
        Parser parser = new Parser(tokens);
        Node tree = parser.parse();

        JSONObject content = newContent("PARSE_RESULT");
        content.put("tokens", TokenTable.toJSON(tokens));
        content.put("tree", tree.toJSON());
        content.put("remaining", tokens.size() - parser.getPosition());
        if (render)
            content.put("rendered", TreeRenderer.render(tree));
        return content;
    }

    public static JSONObject error(String category, String message)
    {
        JSONObject content = newContent("ERROR");
        content.put("error", category);
        content.put("message", message);
        return content;
    }

    static JSONObject newContent(String type)
    {
        JSONObject content = new JSONObject();
        content.put("type", type);
        content.put("messageID", "%nextid%");
        content.put("timestamp", System.currentTimeMillis());
        return content;
    }

    public static String wrap(JSONObject content)
    {
        JSONObject message = new JSONObject();
        message.put("Message", content);
        return message.toString();
    }
}
