package com.cywriter.ast;

import java.util.Arrays;

public record BytesNode(
    byte[] value
) implements AtomicExprNode {
    public BytesNode {
        value = value.clone();
    }

    @Override
    public byte[] value() {
        return value.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BytesNode other && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "BytesNode[value=" + Arrays.toString(value) + "]";
    }

    @Override
    public String type() {
        return "BytesNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitBytes(this);
    }
}
