package com.cywriter.ast;

public record IntNode(
    String value,     // Literal digits as written, e.g. "0x1F"
    String unsigned,  // "" or "U"
    String longness   // "", "L" or "LL"
) implements AtomicExprNode {
    public IntNode {
        unsigned = unsigned == null ? "" : unsigned;
        longness = longness == null ? "" : longness;
    }

    public IntNode(String value) {
        this(value, "", "");
    }

    @Override
    public String type() {
        return "IntNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitInt(this);
    }
}
