package com.cywriter;

import com.cywriter.ast.Node;

/**
 * A known node kind uses a field combination that the writer deliberately does not render,
 * e.g. keyword arguments in a general call.
 */
public class UnsupportedConstructException extends CodeWriterException {
    private final String construct;

    public UnsupportedConstructException(Node node, String construct) {
        super(node, "Unsupported construct in " + node.type() + ": " + construct);
        this.construct = construct;
    }

    public String getConstruct() {
        return construct;
    }
}
