package com.yangproto.generator.parser;

/**
 * Raised when a statement-tree dump is not well formed.
 */
public class StatementTreeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StatementTreeException(String message) {
        super(message);
    }

    public StatementTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
