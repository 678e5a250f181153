package com.cywriter.ast;

/**
 * Implemented by nodes that may carry a default value ({@code x = 1} in a declaration or
 * argument list).
 */
public interface HasDefaultValue {

    /**
     * @return the default value expression, or null if there is none
     */
    ExprNode defaultValue();
}
