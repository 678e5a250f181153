package com.cywriter.json;

import com.cywriter.ast.Node;

/**
 * Writes code trees as JSON. Every node object carries a {@code "type"} member naming its kind.
 */
public interface AstJsonSerializer {

    /**
     * @throws AstJsonException if the tree cannot be written
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Same as {@link #serialize(Node)} with indentation and line breaks.
     *
     * @throws AstJsonException if the tree cannot be written
     */
    String serializePretty(Node node) throws AstJsonException;
}
