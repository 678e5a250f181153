package com.cywriter;

import com.cywriter.ast.CFuncDefNode;
import com.cywriter.ast.Node;
import com.cywriter.ast.StatNode;

/**
 * Writes only the declarations of a tree, as they would appear in a {@code .pxd} file.
 * Function bodies are dropped, inline functions are left out entirely and statements that
 * declare nothing produce no output. A block left with no members gets a {@code pass} body.
 */
public class PxdWriter extends DeclarationWriter {

    public PxdWriter() {
        super();
    }

    public PxdWriter(LinesResult result) {
        super(result);
    }

    @Override
    protected void indented(Node node) {
        int before = result.lines().size();
        super.indented(node);
        if (result.lines().size() == before) {
            indent();
            line("pass");
            dedent();
        }
    }

    @Override
    public void visitCFuncDef(CFuncDefNode node) {
        if (node.isInline()) {
            return;
        }
        startFunctionHeader(node);
        putTypePrefix(node.baseType());
        visit(node.declarator());
        endLine();
    }

    @Override
    public void visitStat(StatNode node) {
        // Not a declaration
    }
}
