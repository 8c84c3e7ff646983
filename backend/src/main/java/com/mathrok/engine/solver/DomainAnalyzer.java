package com.mathrok.engine.solver;

import com.mathrok.engine.ast.ExprNode;
import com.mathrok.engine.ast.ExprNode.FunctionNode;
import com.mathrok.engine.ast.ExprNode.OperatorNode;
import com.mathrok.engine.ast.ExpressionPrinter;
import com.mathrok.engine.ast.Expressions;
import com.mathrok.engine.lexer.MathFunctions;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Collects the conditions under which an equation is defined for the target variable:
 * non-zero divisors, non-negative square root arguments and positive logarithm arguments.
 */
public class DomainAnalyzer {

    public List<DomainRestriction> analyze(ExprNode equation, String variable) {
        Set<String> seen = new LinkedHashSet<>();
        List<DomainRestriction> restrictions = new ArrayList<>();

        for (ExprNode node : Expressions.findAll(equation, node -> true)) {
            if (node instanceof OperatorNode op && !op.isUnary() && "/".equals(op.symbol())
                    && Expressions.containsVariable(op.right(), variable)) {
                add(restrictions, seen, variable, ExpressionPrinter.print(op.right()) + " ≠ 0",
                        "Denominator cannot be zero");
            } else if (node instanceof FunctionNode fn && !fn.args().isEmpty()
                    && Expressions.containsVariable(fn.args().get(0), variable)) {
                String name = fn.name().toLowerCase(Locale.ROOT);
                String argument = ExpressionPrinter.print(fn.args().get(0));
                if ("sqrt".equals(name)) {
                    add(restrictions, seen, variable, argument + " ≥ 0",
                            "Square root argument must be non-negative");
                } else if (MathFunctions.LOGARITHMIC.contains(name)) {
                    add(restrictions, seen, variable, argument + " > 0",
                            "Logarithm argument must be positive");
                }
            }
        }

        return restrictions;
    }

    private static void add(List<DomainRestriction> restrictions, Set<String> seen, String variable,
            String restriction, String description) {
        if (seen.add(restriction)) {
            restrictions.add(new DomainRestriction(variable, restriction, description));
        }
    }
}
