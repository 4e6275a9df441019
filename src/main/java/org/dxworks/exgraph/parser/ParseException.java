package org.dxworks.exgraph.parser;

/**
 * Raised when source text cannot be read as Elixir.
 */
public class ParseException extends Exception {
    private final String file;
    private final int line;
    private final int column;

    public ParseException(String message, String file, int line, int column) {
        super((file != null ? file : "<string>") + ":" + line + ":" + column + ": " + message);
        this.file = file;
        this.line = line;
        this.column = column;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
