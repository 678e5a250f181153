package com.cywriter;

import com.cywriter.ast.Node;

/**
 * Thrown when a tree cannot be written. The traversal stops at the first failure and any
 * lines written so far are not usable.
 */
public class CodeWriterException extends RuntimeException {
    private final transient Node node;

    public CodeWriterException(Node node, String message) {
        super(message);
        this.node = node;
    }

    public CodeWriterException(Node node, String message, Throwable cause) {
        super(message, cause);
        this.node = node;
    }

    /**
     * The node being written when the failure occurred.
     */
    public Node getNode() {
        return node;
    }
}
