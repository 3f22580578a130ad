package com.causaltest.dag.io;

/**
 * Thrown when dot text cannot be parsed into a graph definition.
 */
public class DotParseException extends IllegalArgumentException {
    private final int line;
    private final int column;

    public DotParseException(String message, int line, int column) {
        super(message + " at line " + line + ", column " + column);
        this.line = line;
        this.column = column;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
