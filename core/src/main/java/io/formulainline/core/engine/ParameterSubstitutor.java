package io.formulainline.core.engine;

import io.formulainline.core.grammar.FormulaLexer;
import io.formulainline.core.grammar.Token;
import io.formulainline.core.grammar.TokenType;
import java.util.Map;

/**
 * Replaces parameter names in formula text with argument text. Matching is on whole tokens, so
 * {@code x} never matches inside {@code max} or inside a string literal; each side of a range such
 * as {@code start:finish} is matched on its own. All replacements happen in one pass, so argument
 * text is never substituted again.
 */
final class ParameterSubstitutor {

    private ParameterSubstitutor() {}

    static String substitute(String text, Map<String, String> bindings) {
        if (bindings.isEmpty()) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        int copied = 0;
        for (Token token : new FormulaLexer(text).tokenize()) {
            String replacement = replacementFor(token, bindings);
            if (replacement != null) {
                out.append(text, copied, token.start()).append(replacement);
                copied = token.end();
            }
        }
        return out.append(text, copied, text.length()).toString();
    }

    private static String replacementFor(Token token, Map<String, String> bindings) {
        if (token.is(TokenType.IDENT) || token.is(TokenType.CELL)) {
            return bindings.get(token.text());
        }
        if (token.is(TokenType.RANGE)) {
            int colon = token.text().indexOf(':');
            String start = token.text().substring(0, colon);
            String end = token.text().substring(colon + 1);
            if (!bindings.containsKey(start) && !bindings.containsKey(end)) {
                return null;
            }
            return bindings.getOrDefault(start, start) + ":" + bindings.getOrDefault(end, end);
        }
        return null;
    }
}
