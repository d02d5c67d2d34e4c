package logictree.parsing;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest
{
    private static List<TokenKind> kinds(String text)
    {
        return Lexer.tokenize(text).stream().map(Token::getKind).collect(Collectors.toList());
    }

    private static Token single(String text)
    {
        List<Token> tokens = Lexer.tokenize(text);
        assertEquals(1, tokens.size(), () -> "tokens of '" + text + "': " + tokens);
        return tokens.get(0);
    }

    @Test
    void tokenizesNestedStatement()
    {
        List<Token> tokens = Lexer.tokenize("x := a and (b or not (c));");

        assertEquals(Arrays.asList(
                TokenKind.IDENT, TokenKind.ASSIGN, TokenKind.IDENT, TokenKind.OP_AND, TokenKind.LPAREN,
                TokenKind.IDENT, TokenKind.OP_OR, TokenKind.OP_NOT, TokenKind.LPAREN, TokenKind.IDENT,
                TokenKind.RPAREN, TokenKind.RPAREN, TokenKind.SEMICOLON),
                tokens.stream().map(Token::getKind).collect(Collectors.toList()));
        assertEquals(Arrays.asList("x", ":=", "a", "and", "(", "b", "or", "not", "(", "c", ")", ")", ";"),
                tokens.stream().map(Token::getText).collect(Collectors.toList()));
    }

    @Test
    void recordsSourceOffsets()
    {
        List<Token> tokens = Lexer.tokenize("x := a;");
        assertEquals(new Token(TokenKind.IDENT, "x", 0), tokens.get(0));
        assertEquals(new Token(TokenKind.ASSIGN, ":=", 2), tokens.get(1));
        assertEquals(new Token(TokenKind.IDENT, "a", 5), tokens.get(2));
        assertEquals(new Token(TokenKind.SEMICOLON, ";", 6), tokens.get(3));
    }

    @Test
    void sameLexemeAtAnotherOffsetIsADifferentToken()
    {
        List<Token> tokens = Lexer.tokenize("a := a;");
        assertEquals(tokens.get(0).getKind(), tokens.get(2).getKind());
        assertEquals(tokens.get(0).getText(), tokens.get(2).getText());
        assertNotEquals(tokens.get(0), tokens.get(2));
        assertEquals(new Token(TokenKind.IDENT, "a", 5), tokens.get(2));
    }

    @Test
    void textsReconstructSourceWithoutWhitespaceAndComments()
    {
        String source = "result := (* flag *) not (p\txor q)\n  and\ttrue or 0FF ;";
        String joined = Lexer.tokenize(source).stream().map(Token::getText).collect(Collectors.joining());
        assertEquals("result:=not(pxorq)andtrueor0FF;", joined);
    }

    @Test
    void emptyInputGivesNoTokens()
    {
        assertTrue(Lexer.tokenize("").isEmpty());
        assertTrue(Lexer.tokenize(" \t\n(* only a comment *)\n").isEmpty());
    }

    @Test
    void literalsKeepTheirExactText()
    {
        assertEquals(new Token(TokenKind.HEX, "1a3", 0), single("1a3"));
        assertEquals(new Token(TokenKind.HEX, "0", 0), single("0"));
        assertEquals(new Token(TokenKind.HEX, "9FfA", 0), single("9FfA"));
        assertEquals(new Token(TokenKind.ROMAN, "IV", 0), single("IV"));
        assertEquals(new Token(TokenKind.ROMAN, "MCM", 0), single("MCM"));
        assertEquals(new Token(TokenKind.CONST, "true", 0), single("true"));
        assertEquals(new Token(TokenKind.CONST, "false", 0), single("false"));
    }

    @Test
    void wordBoundariesDecideBetweenLiteralsAndIdentifiers()
    {
        assertEquals(TokenKind.IDENT, single("true1").getKind());
        assertEquals(TokenKind.IDENT, single("Mix").getKind());
        assertEquals(TokenKind.ROMAN, single("MIX").getKind());
        assertEquals(TokenKind.ROMAN, single("C").getKind());
        assertEquals(TokenKind.IDENT, single("for").getKind());
        assertEquals(TokenKind.IDENT, single("_tmp9").getKind());
        assertEquals(TokenKind.OP_XOR, single("xor").getKind());
    }

    @Test
    void commentsSpanLinesAndStopAtFirstClose()
    {
        assertEquals(Arrays.asList(TokenKind.IDENT, TokenKind.IDENT),
                kinds("a (* one\ntwo *) (* three *) b"));
        assertEquals(Arrays.asList(TokenKind.IDENT, TokenKind.OP_AND, TokenKind.IDENT),
                kinds("a (* x *) and (* y *) b"));
    }

    @Test
    void unterminatedCommentIsNotAComment()
    {
        LexicalException e = assertThrows(LexicalException.class, () -> Lexer.tokenize("(*x"));
        assertEquals("*", e.getLexeme());
        assertEquals(1, e.getOffset());
    }

    @Test
    void strayCharacterFails()
    {
        LexicalException e = assertThrows(LexicalException.class, () -> Lexer.tokenize("x := a @ b;"));
        assertEquals("@", e.getLexeme());
        assertEquals(7, e.getOffset());
        assertEquals("LEXICAL", e.getCategory());
        assertTrue(e.getMessage().contains("'@'"));
    }

    @Test
    void carriageReturnIsNotWhitespace()
    {
        assertThrows(LexicalException.class, () -> Lexer.tokenize("x := a;\r\n"));
    }

    @Test
    void keywordsWinEvenInsideLongerWords()
    {
        LexicalException notx = assertThrows(LexicalException.class, () -> Lexer.tokenize("notx"));
        assertEquals("x", notx.getLexeme());
        assertEquals(3, notx.getOffset());

        LexicalException android = assertThrows(LexicalException.class, () -> Lexer.tokenize("android"));
        assertEquals("r", android.getLexeme());
        assertEquals(3, android.getOffset());

        LexicalException order = assertThrows(LexicalException.class, () -> Lexer.tokenize("order"));
        assertEquals("d", order.getLexeme());
        assertEquals(2, order.getOffset());

        LexicalException xor = assertThrows(LexicalException.class, () -> Lexer.tokenize("xor_"));
        assertEquals("_", xor.getLexeme());
        assertEquals(3, xor.getOffset());
    }

    @Test
    void hexMustEndOnAWordBoundary()
    {
        LexicalException e = assertThrows(LexicalException.class, () -> Lexer.tokenize("1g"));
        assertEquals("1", e.getLexeme());
        assertEquals(0, e.getOffset());
    }

    @Test
    void identifiersAreLimitedToThirtyTwoCharacters()
    {
        StringBuilder sb = new StringBuilder("v");
        for (int i = 0; i < 31; i++)
            sb.append('w');
        String longest = sb.toString();

        assertEquals(new Token(TokenKind.IDENT, longest, 0), single(longest));

        LexicalException e = assertThrows(LexicalException.class, () -> Lexer.tokenize(longest + "w"));
        assertEquals("v", e.getLexeme());
        assertEquals(0, e.getOffset());
    }

    @Test
    void nextTokenStreamsUntilExhausted()
    {
        Lexer lexer = new Lexer("a  b");
        assertEquals("a", lexer.nextToken().getText());
        assertEquals("b", lexer.nextToken().getText());
        assertNull(lexer.nextToken());
        assertEquals(4, lexer.getPosition());
    }
}
