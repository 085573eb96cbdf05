package io.formulainline.core.grammar;

import io.formulainline.core.error.FormulaParseException;
import io.formulainline.core.model.ArrayLiteral;
import io.formulainline.core.model.BinaryOp;
import io.formulainline.core.model.CellReference;
import io.formulainline.core.model.EmptyArgument;
import io.formulainline.core.model.FunctionCall;
import io.formulainline.core.model.Identifier;
import io.formulainline.core.model.Node;
import io.formulainline.core.model.NumberLiteral;
import io.formulainline.core.model.Operator;
import io.formulainline.core.model.ParenthesizedExpression;
import io.formulainline.core.model.RangeReference;
import io.formulainline.core.model.Span;
import io.formulainline.core.model.StringLiteral;
import io.formulainline.core.model.UnaryOp;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for formula text.
 *
 * <pre>
 * formula    := expression EOF
 * expression := unary (OPERATOR unary)*
 * unary      := ('+' | '-') unary | primary
 * primary    := NUMBER | STRING | CELL | RANGE
 *             | IDENT '(' arguments ')' | IDENT
 *             | '(' expression ')'
 *             | '{' row (';' row)* '}'
 * arguments  := &lt;nothing&gt; | argument (',' argument)*
 * argument   := expression | &lt;empty&gt;
 * row        := expression (',' expression)*
 * </pre>
 *
 * <p>
 * Binary chains are left-associative at a single level. A prefix sign must touch its operand:
 * {@code --A1} and {@code A1*-1} parse, {@code A1 + + B1} does not. The whole input must be one
 * expression; anything left over is an error, never a truncated tree.
 *
 * <p>
 * Thread-safe: each {@link #parse} call uses its own lexer and cursor.
 */
public final class FormulaParser {

    /**
     * Parses {@code text} into a tree.
     *
     * @param text formula text without leading {@code =} and without comments
     * @return the root node
     * @throws FormulaParseException if the text is not exactly one well-formed expression
     */
    public Node parse(String text) {
        if (text == null) {
            throw new NullPointerException("text must not be null");
        }
        return new Cursor(text, new FormulaLexer(text).tokenize()).parseFormula();
    }

    private static final class Cursor {

        private final String input;
        private final List<Token> tokens;
        private int position;
        private int callDepth;

        private Cursor(String input, List<Token> tokens) {
            this.input = input;
            this.tokens = tokens;
        }

        Node parseFormula() {
            Node root = parseExpression();
            if (!current().is(TokenType.EOF)) {
                throw error("an operator or end of input, found " + current());
            }
            return root;
        }

        private Node parseExpression() {
            Node left = parseUnary(false);
            while (current().is(TokenType.OPERATOR)) {
                Operator op = operator(advance());
                left = new BinaryOp(op, left, parseUnary(true));
            }
            return left;
        }

        // After a binary operator a sign must touch its operand, so "A1 + + B1" is rejected.
        private Node parseUnary(boolean afterBinary) {
            Token token = current();
            if (token.is(TokenType.OPERATOR)) {
                Operator op = operator(token);
                if (!op.isUnary()) {
                    throw error("an operand, found binary operator " + token);
                }
                advance();
                if (current().is(TokenType.EOF) || (afterBinary && current().spaceBefore())) {
                    throw error("an operand directly after prefix " + token);
                }
                return new UnaryOp(op, parseUnary(afterBinary));
            }
            return parsePrimary();
        }

        private Node parsePrimary() {
            Token token = current();
            switch (token.type()) {
                case NUMBER:
                    advance();
                    return new NumberLiteral(token.text());
                case STRING:
                    advance();
                    return new StringLiteral(token.value(), token.quote(), token.escaping());
                case CELL:
                    advance();
                    return new CellReference(token.text());
                case RANGE:
                    advance();
                    return new RangeReference(token.text());
                case IDENT:
                    advance();
                    if (current().is(TokenType.LPAREN)) {
                        return parseCall(token);
                    }
                    return new Identifier(token.text());
                case LPAREN:
                    advance();
                    Node inner = parseExpression();
                    expect(TokenType.RPAREN, "')' closing '(' at " + token.start());
                    return new ParenthesizedExpression(inner);
                case LBRACE:
                    return parseArray();
                default:
                    throw error("an operand (number, string, reference, name, call, '(' or '{'), found " + token);
            }
        }

        private FunctionCall parseCall(Token name) {
            int depth = callDepth;
            callDepth++;
            advance(); // '('
            List<Node> args = new ArrayList<>();
            Token close;
            if (current().is(TokenType.RPAREN)) {
                close = advance();
            } else {
                while (true) {
                    if (current().is(TokenType.COMMA) || current().is(TokenType.RPAREN)) {
                        args.add(EmptyArgument.INSTANCE);
                    } else {
                        args.add(parseExpression());
                    }
                    if (current().is(TokenType.COMMA)) {
                        advance();
                        continue;
                    }
                    close = expect(TokenType.RPAREN, "',' or ')' in call to " + name.text());
                    break;
                }
            }
            callDepth--;
            return new FunctionCall(name.text(), args, depth, new Span(name.start(), close.end()));
        }

        private ArrayLiteral parseArray() {
            Token open = advance(); // '{'
            List<List<Node>> rows = new ArrayList<>();
            List<Node> row = new ArrayList<>();
            while (true) {
                Token token = current();
                if (token.is(TokenType.COMMA)
                        || token.is(TokenType.SEMICOLON)
                        || token.is(TokenType.RBRACE)
                        || token.is(TokenType.EOF)) {
                    throw error("an array element, found " + token);
                }
                row.add(parseExpression());
                if (current().is(TokenType.COMMA)) {
                    advance();
                } else if (current().is(TokenType.SEMICOLON)) {
                    advance();
                    rows.add(row);
                    row = new ArrayList<>();
                } else {
                    expect(TokenType.RBRACE, "',', ';' or '}' closing '{' at " + open.start());
                    rows.add(row);
                    return new ArrayLiteral(rows);
                }
            }
        }

        private Operator operator(Token token) {
            return Operator.fromSymbol(token.text())
                    .orElseThrow(() -> new FormulaParseException("a known operator", token.start(), input));
        }

        private Token expect(TokenType type, String description) {
            if (!current().is(type)) {
                throw error(description + ", found " + current());
            }
            return advance();
        }

        private Token current() {
            return tokens.get(position);
        }

        private Token advance() {
            Token token = tokens.get(position);
            if (!token.is(TokenType.EOF)) {
                position++;
            }
            return token;
        }

        private FormulaParseException error(String expected) {
            return new FormulaParseException(expected, current().start(), input);
        }
    }
}
