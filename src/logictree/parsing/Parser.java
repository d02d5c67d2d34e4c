package logictree.parsing;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Predictive recursive descent over a token list, one token of lookahead.
 * <pre>
 * S -> IDENT := F ;
 * F -> T { (or | xor) T }
 * T -> E { and E }
 * E -> ( F ) | not ( F ) | IDENT | CONST | ROMAN | HEX
 * </pre>
 * An instance holds its own cursor and must not be shared between threads.
 * Nesting, whether by parentheses or by chained operators, is capped at
 * {@link #MAX_DEPTH} tree levels.
 */
public class Parser
{
    public static final int MAX_DEPTH = 256;

    private static final Set<TokenKind> ATOM_START = EnumSet.of(
            TokenKind.LPAREN, TokenKind.OP_NOT,
            TokenKind.IDENT, TokenKind.CONST, TokenKind.ROMAN, TokenKind.HEX);

    private final List<Token> tokens;
    private int pos = 0;
    private int nesting = 0;
    private Node root;

    public Parser(List<Token> tokens)
    {
        this.tokens = tokens;
    }

    public static Node parse(String text)
    {
        return new Parser(Lexer.tokenize(text)).parse();
    }

    public Node parse()
    {
        if (root != null)
            return root;

        root = statement();
        return root;
    }

    /** True if tokens are left over after the statement's semicolon. */
    public boolean hasRemaining()
    {
        return pos < tokens.size();
    }

    public int getPosition()
    {
        return pos;
    }

    private Node statement()
    {
        Node target = Node.of(Symbol.OPERAND, match(TokenKind.IDENT));
        Node assign = match(TokenKind.ASSIGN);
        Node value = disjunction();
        Node end = match(TokenKind.SEMICOLON);
        return Node.of(Symbol.STATEMENT, target, assign, value, end);
    }

    private Node disjunction()
    {
        Node node = conjunction();
        while (peek(TokenKind.OP_OR) || peek(TokenKind.OP_XOR))
        {
            Node op = match(current().getKind());
            Node right = conjunction();
            node = checkHeight(Node.of(Symbol.DISJUNCTION, node, op, right));
        }
        return node;
    }

    private Node conjunction()
    {
        Node node = atom();
        while (peek(TokenKind.OP_AND))
        {
            Node op = match(TokenKind.OP_AND);
            Node right = atom();
            node = checkHeight(Node.of(Symbol.CONJUNCTION, node, op, right));
        }
        return node;
    }

    private Node atom()
    {
        if (peek(TokenKind.LPAREN))
        {
            Node lpar = match(TokenKind.LPAREN);
            Node inner = nested();
            Node rpar = match(TokenKind.RPAREN);
            return checkHeight(Node.of(Symbol.ATOM, lpar, inner, rpar));
        }
        else if (peek(TokenKind.OP_NOT))
        {
            Node not = match(TokenKind.OP_NOT);
            Node lpar = match(TokenKind.LPAREN);
            Node inner = nested();
            Node rpar = match(TokenKind.RPAREN);
            return checkHeight(Node.of(Symbol.ATOM, not, lpar, inner, rpar));
        }
        else if (current() != null && current().getKind().isOperand())
        {
            Node operand = match(current().getKind());
            return Node.of(Symbol.ATOM, Node.of(Symbol.OPERAND, operand));
        }
        else
        {
            throw new SyntaxException(ATOM_START, currentKind(), pos);
        }
    }

    private Node nested()
    {
        if (++nesting > MAX_DEPTH)
            throw new NestingTooDeepException(MAX_DEPTH, pos);

        Node inner = disjunction();
        nesting--;
        return inner;
    }

    private Node checkHeight(Node node)
    {
        if (node.getHeight() > MAX_DEPTH)
            throw new NestingTooDeepException(MAX_DEPTH, pos);
        return node;
    }

    Node match(TokenKind expected)
    {
        Token token = current();
        if (token == null || token.getKind() != expected)
            throw new SyntaxException(expected, currentKind(), pos);

        pos++;
        return Node.leaf(token);
    }

    boolean peek(TokenKind kind)
    {
        Token token = current();
        return token != null && token.getKind() == kind;
    }

    private Token current()
    {
        return pos < tokens.size() ? tokens.get(pos) : null;
    }

    private TokenKind currentKind()
    {
        Token token = current();
        return token == null ? null : token.getKind();
    }
}
