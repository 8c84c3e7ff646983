package com.mathrok.engine.solver;

public record DomainRestriction(
        String variable,
        String restriction,
        String description
) {
}
