package com.mathrok.engine.solver;

import com.mathrok.engine.ast.ExprNode;
import com.mathrok.engine.classify.EquationType;
import com.mathrok.engine.config.MathConfig;

/**
 * Input of a single solver: the equation with caller bindings already substituted.
 */
public record SolveContext(
        ExprNode equation,
        String variable,
        EquationType type,
        MathConfig config
) {

    public SolveContext withType(EquationType newType) {
        return new SolveContext(equation, variable, newType, config);
    }
}
