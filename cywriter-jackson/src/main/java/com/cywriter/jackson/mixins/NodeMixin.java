package com.cywriter.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Polymorphic handling for every node type: the concrete kind travels in a {@code "type"}
 * member whose value is the node's {@code type()}. Subtypes are registered by
 * {@link com.cywriter.jackson.AstModule}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
public interface NodeMixin {
}
