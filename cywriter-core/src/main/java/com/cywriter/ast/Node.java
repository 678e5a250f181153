package com.cywriter.ast;

/**
 * Base interface for all Cython code tree nodes.
 */
public sealed interface Node permits
    ModuleNode,
    StatNode,
    ExprNode,
    DeclaratorNode,
    BaseTypeNode,
    CArgDeclNode,
    CEnumDefItemNode,
    IfClauseNode,
    ExceptClauseNode,
    DecoratorNode,
    DictItemNode {

    /**
     * Kind name of this node, e.g. {@code "ForInStatNode"}.
     */
    String type();

    /**
     * Dispatches to the visitor method for this node's exact kind.
     */
    void accept(TreeVisitor visitor);
}
