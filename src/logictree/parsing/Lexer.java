package logictree.parsing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Splits source text into tokens. At each position every {@link TokenKind} is
 * tried in declaration order and the first one matching there wins.
 */
public class Lexer
{
    private final String input;
    private final Map<TokenKind, Matcher> matchers = new EnumMap<>(TokenKind.class);
    private int position = 0;

    public Lexer(String input)
    {
        this.input = input;

        for (TokenKind kind : TokenKind.values())
        {
            Matcher m = kind.pattern().matcher(input);
            // \b has to see the character before the region start
            m.useTransparentBounds(true);
            m.useAnchoringBounds(false);
            matchers.put(kind, m);
        }
    }

    public static List<Token> tokenize(String text)
    {
        Lexer lexer = new Lexer(text);
        List<Token> tokens = new ArrayList<>();

        Token token;
        while ((token = lexer.nextToken()) != null)
            tokens.add(token);

        return Collections.unmodifiableList(tokens);
    }

    /**
     * @return the next emitted token, or {@code null} once the input is exhausted
     * @throws LexicalException on a character no rule accepts
     */
    public Token nextToken()
    {
        while (position < input.length())
        {
            int start = position;
            TokenKind kind = null;
            String lexeme = null;

            for (Map.Entry<TokenKind, Matcher> e : matchers.entrySet())
            {
                Matcher m = e.getValue();
                m.region(start, input.length());
                if (m.lookingAt())
                {
                    kind = e.getKey();
                    lexeme = m.group();
                    break;
                }
            }

            // MISMATCH accepts any character, so something always matched
            position = start + lexeme.length();

            if (kind == TokenKind.MISMATCH)
                throw new LexicalException(lexeme, start);
            if (!kind.isDiscarded())
                return new Token(kind, lexeme, start);
        }

        return null;
    }

    public int getPosition()
    {
        return position;
    }
}
