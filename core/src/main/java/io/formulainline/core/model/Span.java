package io.formulainline.core.model;

/**
 * Half-open character range {@code [start, end)} in the text a node was parsed from.
 *
 * @param start offset of the first character
 * @param end   offset one past the last character
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    /** True if {@code other} lies inside this span and is not equal to it. */
    public boolean strictlyContains(Span other) {
        return start <= other.start && other.end <= end && !equals(other);
    }

    /** The covered substring of {@code text}. */
    public String slice(String text) {
        return text.substring(start, end);
    }
}
