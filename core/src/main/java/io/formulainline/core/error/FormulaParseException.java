package io.formulainline.core.error;

/**
 * Thrown when formula text cannot be consumed as exactly one expression. Always carries the
 * character offset at which parsing stopped and a description of what the grammar expected there.
 */
public final class FormulaParseException extends FormulaException {

    private static final long serialVersionUID = 1L;

    private final int position;
    private final String expected;
    private final String input;

    public FormulaParseException(String expected, int position, String input) {
        this(expected, position, input, null, null);
    }

    public FormulaParseException(String expected, int position, String input, String formulaName, Throwable cause) {
        super(buildMessage(expected, position, input, formulaName), cause, formulaName, Phase.PARSE);
        this.position = position;
        this.expected = expected;
        this.input = input;
    }

    /** Returns a copy of this exception attributed to the given formula. */
    public FormulaParseException withFormulaName(String name) {
        return new FormulaParseException(expected, position, input, name, this);
    }

    /** Zero-based character offset into {@link #input()}. */
    public int position() {
        return position;
    }

    /** What the grammar expected at {@link #position()}. */
    public String expected() {
        return expected;
    }

    /** The text that was being parsed. */
    public String input() {
        return input;
    }

    private static String buildMessage(String expected, int position, String input, String formulaName) {
        StringBuilder message = new StringBuilder();
        if (formulaName != null) {
            message.append(formulaName).append(": ");
        }
        message.append("Syntax error at position ").append(position).append(": expected ").append(expected);
        if (input != null) {
            int lineStart = input.lastIndexOf('\n', Math.max(0, position - 1)) + 1;
            int lineEnd = input.indexOf('\n', position);
            String line = input.substring(lineStart, lineEnd < 0 ? input.length() : lineEnd);
            message.append("\n  Line: ").append(line);
            message.append("\n  Location: ").append(" ".repeat(Math.max(0, position - lineStart))).append('^');
        }
        return message.toString();
    }
}
