package com.gearcheck.matching;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScriptTokenizerTest {

    @Test
    void tokenizesSimpleAssignment() {
        List<ScriptToken> tokens = ScriptTokenizer.tokenize("main=\"Aeneas\"");
        assertEquals(3, tokens.size());
        assertTrue(tokens.get(0).isIdentifier("main"));
        assertTrue(tokens.get(1).is(ScriptToken.Type.ASSIGN));
        assertTrue(tokens.get(2).is(ScriptToken.Type.STRING));
        assertEquals("Aeneas", tokens.get(2).getText());
        assertEquals(5, tokens.get(2).getStart());
        assertEquals(13, tokens.get(2).getEnd());
    }

    @Test
    void comparisonOperatorsAreNotAssignments() {
        List<ScriptToken> tokens = ScriptTokenizer.tokenize("a == 'x' b ~= 'y' c <= d e >= f");
        for (ScriptToken token : tokens) {
            assertFalse(token.is(ScriptToken.Type.ASSIGN), token.toString());
        }
    }

    @Test
    void quoteWithoutPartnerOnLineIsSkipped() {
        List<ScriptToken> tokens = ScriptTokenizer.tokenize("-- don't forget\nhead='Nyame Helm'");
        ScriptToken last = tokens.get(tokens.size() - 1);
        assertTrue(last.is(ScriptToken.Type.STRING));
        assertEquals("Nyame Helm", last.getText());
        assertTrue(tokens.get(tokens.size() - 3).isIdentifier("head"));
    }

    @Test
    void longLineOfUnclosedEscapedQuotesScansQuickly() {
        String line = "\"" + "\\\"".repeat(200_000);
        List<ScriptToken> tokens = assertTimeoutPreemptively(Duration.ofSeconds(2),
            () -> ScriptTokenizer.tokenize(line));
        for (ScriptToken token : tokens) {
            assertFalse(token.is(ScriptToken.Type.STRING));
        }
    }

    @Test
    void unclosedQuoteOnOneLineDoesNotAffectNextLine() {
        List<ScriptToken> tokens = ScriptTokenizer.tokenize("x = \"open \\\"again\nmain=\"Aeneas\" sub='Utu Grip'");
        assertTrue(tokens.get(2).is(ScriptToken.Type.OTHER));
        assertTrue(tokens.get(3).isIdentifier("open"));
        assertEquals("\\", tokens.get(4).getText());
        assertTrue(tokens.get(5).is(ScriptToken.Type.OTHER));
        assertEquals("\"", tokens.get(5).getText());
        assertTrue(tokens.get(6).isIdentifier("again"));
        ScriptToken aeneas = tokens.get(tokens.size() - 4);
        assertTrue(aeneas.is(ScriptToken.Type.STRING));
        assertEquals("Aeneas", aeneas.getText());
        assertEquals("Utu Grip", tokens.get(tokens.size() - 1).getText());
    }

    @Test
    void backslashEscapesQuote() {
        List<ScriptToken> tokens = ScriptTokenizer.tokenize("x = \"a\\\"b\"");
        ScriptToken string = tokens.get(2);
        assertTrue(string.is(ScriptToken.Type.STRING));
        assertEquals("a\\\"b", string.getText());
    }

    @Test
    void bracesAndCommasHaveTheirOwnTypes() {
        List<ScriptToken> tokens = ScriptTokenizer.tokenize("{ a, }");
        assertTrue(tokens.get(0).is(ScriptToken.Type.OPEN_BRACE));
        assertTrue(tokens.get(1).is(ScriptToken.Type.IDENTIFIER));
        assertTrue(tokens.get(2).is(ScriptToken.Type.COMMA));
        assertTrue(tokens.get(3).is(ScriptToken.Type.CLOSE_BRACE));
    }

    @Test
    void nullTextHasNoTokens() {
        assertTrue(ScriptTokenizer.tokenize(null).isEmpty());
    }
}
