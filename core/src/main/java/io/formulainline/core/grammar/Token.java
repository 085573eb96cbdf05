package io.formulainline.core.grammar;

import io.formulainline.core.model.Escaping;

/**
 * A lexical token with its exact source range.
 *
 * @param type        token category
 * @param text        source text of the token, quotes and escapes included
 * @param value       unescaped string content for {@link TokenType#STRING}, otherwise {@code text}
 * @param escaping    escaping convention of a string token, {@code null} for other tokens
 * @param start       offset of the first character
 * @param end         offset one past the last character
 * @param spaceBefore whether whitespace immediately precedes the token
 */
public record Token(
        TokenType type, String text, String value, Escaping escaping, int start, int end, boolean spaceBefore) {

    static Token of(TokenType type, String input, int start, int end, boolean spaceBefore) {
        String text = input.substring(start, end);
        return new Token(type, text, text, null, start, end, spaceBefore);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /** Quote character of a string token. */
    public char quote() {
        return text.charAt(0);
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "end of input" : "'" + text + "'";
    }
}
