package com.cywriter;

import com.cywriter.ast.Node;

import java.util.List;

/**
 * Entry points for turning a code tree back into Cython source lines.
 */
public final class CyWriter {

    private CyWriter() {
        // Utility class
    }

    /**
     * Full source of {@code tree}, as for a {@code .pyx} file.
     */
    public static List<String> writeCode(Node tree) {
        return new CodeWriter().write(tree).lines();
    }

    /**
     * Declarations of {@code tree} only, as for a {@code .pxd} file.
     */
    public static List<String> writeDeclarations(Node tree) {
        return new PxdWriter().write(tree).lines();
    }
}
