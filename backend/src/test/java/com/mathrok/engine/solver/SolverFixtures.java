package com.mathrok.engine.solver;

import com.mathrok.engine.ast.AstBuilder;
import com.mathrok.engine.ast.ExprNode;
import com.mathrok.engine.backend.SymbolicBackendChain;
import com.mathrok.engine.config.MathConfig;
import com.mathrok.engine.config.NumericSettings;
import com.mathrok.engine.lexer.InputNormalizer;
import com.mathrok.engine.lexer.MathLexer;
import com.mathrok.engine.simplify.Simplifier;

import java.util.List;
import java.util.Set;

final class SolverFixtures {

    private SolverFixtures() {
    }

    static ExprNode parse(String source) {
        return new AstBuilder(InputNormalizer.insertImplicitMultiplication(new MathLexer(source).tokenize())).build();
    }

    static MathConfig config(boolean exact, boolean showSteps) {
        return new MathConfig(15, exact, true, showSteps, 10_000, 100, 1000, 20, true, true, Set.of(),
                NumericSettings.defaults());
    }

    static SolverDispatcher dispatcher(SymbolicBackendChain backends) {
        LinearSolver linear = new LinearSolver();
        QuadraticSolver quadratic = new QuadraticSolver(linear);
        return new SolverDispatcher(linear, quadratic, new GeneralizedSolver(quadratic, backends),
                new DomainAnalyzer(), new Simplifier());
    }

    static List<String> ids(List<SolutionStep> steps) {
        return steps.stream().map(SolutionStep::id).toList();
    }

    static List<String> values(List<Solution> solutions) {
        return solutions.stream().map(Solution::value).toList();
    }
}
