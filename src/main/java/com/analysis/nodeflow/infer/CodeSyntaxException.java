package com.analysis.nodeflow.infer;

/** Code that the structured scanner cannot read. */
public class CodeSyntaxException extends RuntimeException {
    private final int line;

    public CodeSyntaxException(String message, int line) {
        super("line " + line + ": " + message);
        this.line = line;
    }

    public int line() {
        return line;
    }
}
