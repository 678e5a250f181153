package com.cywriter.json;

import com.cywriter.ast.ModuleNode;
import com.cywriter.ast.Node;

/**
 * Reads code trees from JSON. Temporary handles with the same id inside one document are
 * read as a single {@link com.cywriter.ast.TempHandle} instance.
 */
public interface AstJsonDeserializer {

    /**
     * @throws AstJsonException if {@code json} is malformed or is not a module
     */
    ModuleNode deserializeModule(String json) throws AstJsonException;

    /**
     * Reads a subtree whose root is expected to be of {@code type}, e.g.
     * {@code StatNode.class} or {@code CFuncDefNode.class}.
     *
     * @throws AstJsonException if {@code json} is malformed or has a different root kind
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
