package com.dashquery.interpolation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.dashquery.interpolation.TemplateSyntaxConfig.*;

/**
 * Tokenizer for query templates.
 * Splits a template into literal text and variable/macro tokens in a single pass.
 * <p>
 * Braced and bracketed forms are matched first, up to their closing delimiter; a bare
 * {@code $name} ends at the first non-identifier character. Anything that does not form a
 * valid token stays literal text, so tokenizing never fails.
 */
public final class TemplateTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public TemplateTokenizer(String input) {
        this.input = input == null ? "" : input;
        this.length = this.input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the template.
     *
     * @return Tokens in source order; adjacent literal text is merged into one TEXT token
     */
    public List<TemplateToken> tokenize() {
        List<TemplateToken> tokens = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        int textStart = 0;

        while (!isAtEnd()) {
            char c = peek();
            int start = pos;

            TemplateToken token = null;
            if (c == Delimiters.DOLLAR) {
                token = readDollar();
            } else if (c == Delimiters.LEFT_BRACKET && peekAt(1) == Delimiters.LEFT_BRACKET) {
                token = readBracketed();
            }

            if (token == null) {
                pos = start;
                if (text.length() == 0) {
                    textStart = pos;
                }
                text.append(advance());
                continue;
            }

            if (text.length() > 0) {
                tokens.add(TemplateToken.text(text.toString(), textStart));
                text.setLength(0);
            }
            tokens.add(token);
        }

        if (text.length() > 0) {
            tokens.add(TemplateToken.text(text.toString(), textStart));
        }
        return tokens;
    }

    /**
     * Names of the variables referenced by a template, in order of first use.
     * Macros are not included.
     */
    public static Set<String> referencedVariables(String template) {
        Set<String> names = new LinkedHashSet<>();
        for (TemplateToken token : new TemplateTokenizer(template).tokenize()) {
            if (token.kind() == TokenKind.VARIABLE) {
                names.add(token.name());
            }
        }
        return names;
    }

    private TemplateToken readDollar() {
        int start = pos;
        advance(); // $

        if (!isAtEnd() && peek() == Delimiters.LEFT_BRACE) {
            return readBraced(start);
        }

        String word = readIdentifier();
        if (word.isEmpty()) {
            return null;
        }

        if (TIME_FILTER.equals(word)) {
            return readTimeFilter(start, word);
        }

        TokenKind macro = MACROS.get(word);
        if (macro != null) {
            // $__timeFrom() and $__timeTo() carry an empty argument list
            if ((macro == TokenKind.TIME_FROM || macro == TokenKind.TIME_TO)
                    && peekAt(0) == Delimiters.LEFT_PAREN && peekAt(1) == Delimiters.RIGHT_PAREN) {
                pos += 2;
            }
            return new TemplateToken(macro, input.substring(start, pos), word, null, null,
                    start, TokenSyntax.BARE, false);
        }

        return new TemplateToken(TokenKind.VARIABLE, input.substring(start, pos), word, null, null,
                start, TokenSyntax.BARE, precededByIn(start));
    }

    private TemplateToken readBraced(int start) {
        int close = input.indexOf(Delimiters.RIGHT_BRACE, pos + 1);
        if (close < 0) {
            return null;
        }
        String content = input.substring(pos + 1, close);
        NameAndFormat parsed = splitNameAndFormat(content);
        if (parsed == null) {
            return null;
        }
        pos = close + 1;
        return classify(start, parsed, TokenSyntax.BRACED);
    }

    private TemplateToken readBracketed() {
        int start = pos;
        int close = input.indexOf("]]", pos + 2);
        if (close < 0) {
            return null;
        }
        String content = input.substring(pos + 2, close);
        NameAndFormat parsed = splitNameAndFormat(content);
        if (parsed == null) {
            return null;
        }
        pos = close + 2;
        return classify(start, parsed, TokenSyntax.BRACKETED);
    }

    private TemplateToken classify(int start, NameAndFormat parsed, TokenSyntax syntax) {
        String text = input.substring(start, pos);
        TokenKind macro = MACROS.get(parsed.name());
        if (macro != null) {
            return new TemplateToken(macro, text, parsed.name(), parsed.format(), null, start, syntax, false);
        }
        return new TemplateToken(TokenKind.VARIABLE, text, parsed.name(), parsed.format(), null,
                start, syntax, precededByIn(start));
    }

    private TemplateToken readTimeFilter(int start, String word) {
        if (isAtEnd() || peek() != Delimiters.LEFT_PAREN) {
            return new TemplateToken(TokenKind.VARIABLE, input.substring(start, pos), word, null, null,
                    start, TokenSyntax.BARE, false);
        }
        int close = input.indexOf(Delimiters.RIGHT_PAREN, pos + 1);
        if (close < 0) {
            return new TemplateToken(TokenKind.VARIABLE, input.substring(start, pos), word, null, null,
                    start, TokenSyntax.BARE, false);
        }
        String argument = input.substring(pos + 1, close).trim();
        pos = close + 1;
        return new TemplateToken(TokenKind.TIME_FILTER, input.substring(start, pos), word, null, argument,
                start, TokenSyntax.BARE, false);
    }

    private String readIdentifier() {
        int start = pos;
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        return input.substring(start, pos);
    }

    private record NameAndFormat(String name, String format) {}

    private static NameAndFormat splitNameAndFormat(String content) {
        int separator = content.indexOf(Delimiters.FORMAT_SEPARATOR);
        String name = separator < 0 ? content : content.substring(0, separator);
        String format = separator < 0 ? null : content.substring(separator + 1);

        if (name.isEmpty()) {
            return null;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!isIdentifierPart(c) && c != Delimiters.DOT) {
                return null;
            }
        }
        if (format != null) {
            if (format.isEmpty()) {
                return null;
            }
            for (int i = 0; i < format.length(); i++) {
                if (!isIdentifierPart(format.charAt(i))) {
                    return null;
                }
            }
        }
        return new NameAndFormat(name, format);
    }

    /**
     * Check whether the text before the given offset ends with "IN" or "IN (", ignoring case
     * and whitespace.
     */
    private boolean precededByIn(int offset) {
        int i = skipWhitespaceBackwards(offset - 1);
        if (i >= 0 && input.charAt(i) == Delimiters.LEFT_PAREN) {
            i = skipWhitespaceBackwards(i - 1);
        }
        int keywordStart = i - IN_KEYWORD.length() + 1;
        if (keywordStart < 0) {
            return false;
        }
        if (!input.regionMatches(true, keywordStart, IN_KEYWORD, 0, IN_KEYWORD.length())) {
            return false;
        }
        return keywordStart == 0 || !isIdentifierPart(input.charAt(keywordStart - 1));
    }

    private int skipWhitespaceBackwards(int index) {
        int i = index;
        while (i >= 0 && Character.isWhitespace(input.charAt(i))) {
            i--;
        }
        return i;
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == Delimiters.UNDERSCORE;
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekAt(int offset) {
        int index = pos + offset;
        return index < length ? input.charAt(index) : '\0';
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}
