package com.mathrok.engine.simplify;

import com.mathrok.engine.ast.ExprNode;

import java.util.Optional;
import java.util.function.Function;

/**
 * A local rewrite applied to a single node whose children are already simplified.
 * Returns empty when the rule does not match.
 */
public interface RewriteRule {

    String name();

    Optional<ExprNode> rewrite(ExprNode node);

    static RewriteRule of(String name, Function<ExprNode, Optional<ExprNode>> rewrite) {
        return new RewriteRule() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Optional<ExprNode> rewrite(ExprNode node) {
                return rewrite.apply(node);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
