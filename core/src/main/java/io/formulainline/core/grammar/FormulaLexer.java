package io.formulainline.core.grammar;

import io.formulainline.core.error.FormulaParseException;
import io.formulainline.core.model.Escaping;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits formula text into {@link Token}s. Whitespace separates tokens but is never required
 * between them. Any character sequence that does not form a token is a {@link
 * FormulaParseException} at its offset.
 *
 * <p>
 * Reference classification:
 *
 * <ul>
 *   <li>{@code side:side} is a range, where a side is a column/cell form ({@code A}, {@code $A$1},
 *       {@code header_row}) or a row form ({@code 2}, {@code $2})
 *   <li>one to three letters followed by digits, each optionally {@code $}-anchored, is a cell,
 *       unless it is directly followed by {@code (} (then it names a function, e.g. {@code LOG10})
 *   <li>anything else starting with a letter or {@code _} is an identifier; {@code .} is allowed
 *       after the first character ({@code NORM.DIST})
 * </ul>
 *
 * <p>
 * Not thread-safe; create one instance per input.
 */
public final class FormulaLexer {

    private static final String SIDE = "(?:\\$?[A-Za-z_][A-Za-z0-9_]*(?:\\$[0-9]+)?|\\$?[0-9]+)";
    private static final Pattern RANGE = Pattern.compile(SIDE + ":" + SIDE);
    private static final Pattern CELL = Pattern.compile("\\$?[A-Za-z]{1,3}\\$?[0-9]+");
    private static final Pattern IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");
    private static final Pattern NUMBER = Pattern.compile("(?:[0-9]+(?:\\.[0-9]+)?|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?");

    private final String input;
    private int index;

    public FormulaLexer(String input) {
        this.input = input;
    }

    /**
     * Tokenizes the whole input. The returned list always ends with an {@link TokenType#EOF} token.
     *
     * @return the tokens in source order
     * @throws FormulaParseException if a character starts no token
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = next();
            tokens.add(token);
        } while (!token.is(TokenType.EOF));
        return tokens;
    }

    private Token next() {
        boolean spaceBefore = skipWhitespace();
        int start = index;
        if (index >= input.length()) {
            return Token.of(TokenType.EOF, input, start, start, spaceBefore);
        }
        char current = input.charAt(index);
        if (current == '"' || current == '\'') {
            return readString(current, spaceBefore);
        }
        if (current == '$' || Character.isLetterOrDigit(current) || current == '_') {
            Token reference = readReference(spaceBefore);
            if (reference != null) {
                return reference;
            }
        }
        if (Character.isDigit(current) || (current == '.' && peekDigit())) {
            return readNumber(spaceBefore);
        }
        if (Character.isLetter(current) || current == '_') {
            return readWord(IDENT, TokenType.IDENT, "an identifier", spaceBefore);
        }
        if (current == '$') {
            throw new FormulaParseException("a cell or range reference after '$'", start, input);
        }
        if ((current == '<' && (peek('>') || peek('='))) || (current == '>' && peek('='))) {
            index += 2;
            return Token.of(TokenType.OPERATOR, input, start, index, spaceBefore);
        }
        index++;
        TokenType type =
                switch (current) {
                    case '(' -> TokenType.LPAREN;
                    case ')' -> TokenType.RPAREN;
                    case '{' -> TokenType.LBRACE;
                    case '}' -> TokenType.RBRACE;
                    case ',' -> TokenType.COMMA;
                    case ';' -> TokenType.SEMICOLON;
                    case '+', '-', '*', '/', '^', '&', '=', '<', '>' -> TokenType.OPERATOR;
                    default -> throw new FormulaParseException(
                            "a token, found unexpected character '" + current + "'", start, input);
                };
        return Token.of(type, input, start, index, spaceBefore);
    }

    /** Range or cell reference starting at the current index, or {@code null} if there is none. */
    private Token readReference(boolean spaceBefore) {
        int start = index;
        Matcher range = RANGE.matcher(input).region(start, input.length());
        if (range.lookingAt() && atWordBoundary(range.end())) {
            index = range.end();
            return Token.of(TokenType.RANGE, input, start, index, spaceBefore);
        }
        Matcher cell = CELL.matcher(input).region(start, input.length());
        if (cell.lookingAt() && atWordBoundary(cell.end())) {
            boolean anchored = input.charAt(start) == '$' || cell.group().indexOf('$') >= 0;
            if (anchored || !followedByOpenParen(cell.end())) {
                index = cell.end();
                return Token.of(TokenType.CELL, input, start, index, spaceBefore);
            }
        }
        return null;
    }

    private Token readWord(Pattern pattern, TokenType type, String description, boolean spaceBefore) {
        Matcher matcher = pattern.matcher(input).region(index, input.length());
        if (!matcher.lookingAt()) {
            throw new FormulaParseException(description, index, input);
        }
        int start = index;
        index = matcher.end();
        return Token.of(type, input, start, index, spaceBefore);
    }

    private Token readNumber(boolean spaceBefore) {
        Token token = readWord(NUMBER, TokenType.NUMBER, "a number", spaceBefore);
        if (!atWordBoundary(index)) {
            throw new FormulaParseException("an operator or delimiter after number " + token.text(), index, input);
        }
        return token;
    }

    /**
     * Reads a quoted string. A quote inside the literal is escaped either by doubling it or by a
     * preceding backslash; one literal may use only one of the two conventions.
     */
    private Token readString(char quote, boolean spaceBefore) {
        int start = index;
        index++; // opening quote
        StringBuilder content = new StringBuilder();
        Escaping escaping = null;
        while (index < input.length()) {
            char current = input.charAt(index);
            if (current == '\\' && index + 1 < input.length() && input.charAt(index + 1) == quote) {
                escaping = requireEscaping(escaping, Escaping.BACKSLASH, start);
                content.append(quote);
                index += 2;
                continue;
            }
            if (current == quote) {
                if (index + 1 < input.length() && input.charAt(index + 1) == quote) {
                    escaping = requireEscaping(escaping, Escaping.DOUBLED, start);
                    content.append(quote);
                    index += 2;
                    continue;
                }
                index++; // closing quote
                return new Token(
                        TokenType.STRING,
                        input.substring(start, index),
                        content.toString(),
                        escaping != null ? escaping : Escaping.DOUBLED,
                        start,
                        index,
                        spaceBefore);
            }
            content.append(current);
            index++;
        }
        throw new FormulaParseException("closing " + quote + " of string literal started at " + start, index, input);
    }

    private Escaping requireEscaping(Escaping current, Escaping found, int start) {
        if (current != null && current != found) {
            throw new FormulaParseException(
                    "a single quote-escaping convention in string literal started at " + start, index, input);
        }
        return found;
    }

    private boolean atWordBoundary(int position) {
        if (position >= input.length()) {
            return true;
        }
        char next = input.charAt(position);
        return !(Character.isLetterOrDigit(next) || next == '_' || next == '.' || next == '$');
    }

    private boolean followedByOpenParen(int position) {
        int i = position;
        while (i < input.length() && Character.isWhitespace(input.charAt(i))) {
            i++;
        }
        return i < input.length() && input.charAt(i) == '(';
    }

    private boolean peek(char expected) {
        return index + 1 < input.length() && input.charAt(index + 1) == expected;
    }

    private boolean peekDigit() {
        return index + 1 < input.length() && Character.isDigit(input.charAt(index + 1));
    }

    private boolean skipWhitespace() {
        int start = index;
        while (index < input.length() && Character.isWhitespace(input.charAt(index))) {
            index++;
        }
        return index > start;
    }
}
