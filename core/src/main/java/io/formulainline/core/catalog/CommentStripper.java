package io.formulainline.core.catalog;

/**
 * Removes block comments and {@code //} line comments from formula text. Quoted strings are copied
 * as they are, whichever quote character and escaping convention they use, so a {@code //} inside a
 * URL literal survives. An unterminated block comment runs to the end of the text.
 */
public final class CommentStripper {

    private CommentStripper() {}

    /**
     * Strips comments from formula text.
     *
     * @param text the raw body, possibly with comments
     * @return the text with every comment removed and everything else unchanged
     */
    public static String strip(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                int end = endOfString(text, i);
                out.append(text, i, end);
                i = end;
            } else if (text.startsWith("/*", i)) {
                int close = text.indexOf("*/", i + 2);
                i = close < 0 ? text.length() : close + 2;
            } else if (text.startsWith("//", i)) {
                int newline = text.indexOf('\n', i);
                i = newline < 0 ? text.length() : newline;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /** Offset just past the string starting at {@code start}, or the text length if unterminated. */
    private static int endOfString(String text, int start) {
        char quote = text.charAt(start);
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length() && text.charAt(i + 1) == quote) {
                i += 2;
            } else if (c == quote) {
                // a doubled quote is an escape; otherwise the string ends here
                if (i + 1 < text.length() && text.charAt(i + 1) == quote) {
                    i += 2;
                } else {
                    return i + 1;
                }
            } else {
                i++;
            }
        }
        return text.length();
    }
}
