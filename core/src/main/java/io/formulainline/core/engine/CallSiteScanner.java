package io.formulainline.core.engine;

import io.formulainline.core.grammar.FormulaLexer;
import io.formulainline.core.grammar.Token;
import io.formulainline.core.grammar.TokenType;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Token-level scan for {@code NAME(} where {@code NAME} is a catalog formula. Works on text alone,
 * independently of any {@link io.formulainline.core.spi.CallExtractor}, and ignores string content.
 */
final class CallSiteScanner {

    private CallSiteScanner() {}

    /** Sorted names of catalog formulas that are still called in {@code text}. */
    static Set<String> calledNames(String text, Set<String> knownNames) {
        Set<String> called = new TreeSet<>();
        List<Token> tokens = new FormulaLexer(text).tokenize();
        for (int i = 0; i + 1 < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.is(TokenType.IDENT)
                    && tokens.get(i + 1).is(TokenType.LPAREN)
                    && knownNames.contains(token.text())) {
                called.add(token.text());
            }
        }
        return called;
    }
}
