package io.formulainline.core.model;

/** How a quote character is escaped inside a string literal. */
public enum Escaping {
    /** The quote is written twice: {@code "He said ""hi"""}. */
    DOUBLED,
    /** The quote is preceded by a backslash: {@code "He said \"hi\""}. */
    BACKSLASH
}
