package com.rift.exception;

/**
 * Exception thrown when the token stream does not form a valid expression.
 * Position is the 1-based column of the offending token, or one past the
 * last token when the stream ended early.
 */
public class ParseException extends RiftException {

    public enum Kind {
        UNEXPECTED_TOKEN,
        UNEXPECTED_END
    }

    private final Kind kind;
    private final int position;

    public ParseException(Kind kind, int position, String message) {
        super("Parse error at position " + position + ": " + message);
        this.kind = kind;
        this.position = position;
    }

    public Kind getKind() {
        return kind;
    }

    public int getPosition() {
        return position;
    }
}
