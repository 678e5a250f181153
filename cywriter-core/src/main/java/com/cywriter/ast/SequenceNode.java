package com.cywriter.ast;

import java.util.List;

public sealed interface SequenceNode extends ExprNode permits TupleNode, ListNode {

    List<ExprNode> args();
}
