package com.cywriter;

import com.cywriter.ast.Node;

/**
 * A node kind reached the writer with no rule for it or for any of its categories.
 */
public class UnhandledNodeException extends CodeWriterException {

    public UnhandledNodeException(Node node) {
        super(node, "Node not handled by serializer: " + node.type() + " " + node);
    }
}
