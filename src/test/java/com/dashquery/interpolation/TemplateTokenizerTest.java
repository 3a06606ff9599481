package com.dashquery.interpolation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TemplateTokenizer.
 */
class TemplateTokenizerTest {

    private static List<TemplateToken> tokenize(String template) {
        return new TemplateTokenizer(template).tokenize();
    }

    private static TemplateToken single(String template) {
        List<TemplateToken> tokens = tokenize(template);
        assertEquals(1, tokens.size(), "tokens: " + tokens);
        return tokens.get(0);
    }

    @Test
    @DisplayName("Template without tokens is a single text token")
    void plainText() {
        TemplateToken token = single("SELECT count(*) FROM orders");

        assertEquals(TokenKind.TEXT, token.kind());
        assertEquals("SELECT count(*) FROM orders", token.text());
    }

    @Test
    @DisplayName("Empty template has no tokens")
    void emptyTemplate() {
        assertTrue(tokenize("").isEmpty());
        assertTrue(tokenize(null).isEmpty());
    }

    @Test
    @DisplayName("Bare variable ends at the first non-identifier character")
    void bareVariable() {
        List<TemplateToken> tokens = tokenize("host=$hostname.");

        assertEquals(3, tokens.size());
        assertEquals("host=", tokens.get(0).text());
        assertEquals(TokenKind.VARIABLE, tokens.get(1).kind());
        assertEquals("hostname", tokens.get(1).name());
        assertEquals(TokenSyntax.BARE, tokens.get(1).syntax());
        assertEquals(5, tokens.get(1).position());
        assertEquals(".", tokens.get(2).text());
    }

    @Test
    @DisplayName("Braced variable separates a name from following identifier text")
    void bracedVariable() {
        List<TemplateToken> tokens = tokenize("${host}name");

        assertEquals(2, tokens.size());
        assertEquals("host", tokens.get(0).name());
        assertEquals(TokenSyntax.BRACED, tokens.get(0).syntax());
        assertEquals("name", tokens.get(1).text());
    }

    @Test
    @DisplayName("Braced variable carries its format suffix")
    void bracedFormat() {
        TemplateToken token = single("${region:sqlstring}");

        assertEquals(TokenKind.VARIABLE, token.kind());
        assertEquals("region", token.name());
        assertEquals("sqlstring", token.format());
        assertEquals("${region:sqlstring}", token.text());
    }

    @Test
    @DisplayName("Bracketed legacy syntax is recognized")
    void bracketedVariable() {
        TemplateToken token = single("[[env:csv]]");

        assertEquals(TokenKind.VARIABLE, token.kind());
        assertEquals("env", token.name());
        assertEquals("csv", token.format());
        assertEquals(TokenSyntax.BRACKETED, token.syntax());
    }

    @Test
    @DisplayName("Time macros are classified by kind")
    void timeMacros() {
        List<TemplateToken> tokens = tokenize("$__timeFrom $__timeTo() ${__from} $__to");

        assertEquals(TokenKind.TIME_FROM, tokens.get(0).kind());
        assertEquals(TokenKind.TIME_TO, tokens.get(2).kind());
        assertEquals("$__timeTo()", tokens.get(2).text());
        assertEquals(TokenKind.EPOCH_FROM, tokens.get(4).kind());
        assertEquals(TokenKind.EPOCH_TO, tokens.get(6).kind());
    }

    @Test
    @DisplayName("Time filter macro captures its column argument")
    void timeFilter() {
        List<TemplateToken> tokens = tokenize("WHERE $__timeFilter( created_at ) AND x");

        TemplateToken filter = tokens.get(1);
        assertEquals(TokenKind.TIME_FILTER, filter.kind());
        assertEquals("created_at", filter.argument());
        assertEquals("$__timeFilter( created_at )", filter.text());
        assertEquals(" AND x", tokens.get(2).text());
    }

    @Test
    @DisplayName("Tokens after IN are flagged as IN-clause tokens")
    void inClauseDetection() {
        assertTrue(tokenize("WHERE id IN ($ids)").get(1).inClause());
        assertTrue(tokenize("WHERE id in (${ids})").get(1).inClause());
        assertTrue(tokenize("WHERE id IN $ids").get(1).inClause());
        assertFalse(tokenize("WHERE id = $ids").get(1).inClause());
        assertFalse(tokenize("FROM t JOIN ($ids)").get(1).inClause());
    }

    @ParameterizedTest
    @ValueSource(strings = {"$", "price in $", "${unclosed", "${}", "${a b}", "${x:}", "[[open", "[[]]"})
    @DisplayName("Malformed tokens stay literal text")
    void malformedTokensAreText(String template) {
        List<TemplateToken> tokens = tokenize(template);

        assertEquals(1, tokens.size());
        assertEquals(TokenKind.TEXT, tokens.get(0).kind());
        assertEquals(template, tokens.get(0).text());
    }

    @Test
    @DisplayName("Referenced variables are listed once in order of first use, macros excluded")
    void referencedVariables() {
        String template = "SELECT $a, ${b:csv} FROM t WHERE $__timeFilter(ts) AND c = [[c]] AND d = $a";

        assertEquals(List.of("a", "b", "c"), List.copyOf(TemplateTokenizer.referencedVariables(template)));
    }
}
