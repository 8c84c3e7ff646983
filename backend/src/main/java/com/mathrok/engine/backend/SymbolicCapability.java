package com.mathrok.engine.backend;

public enum SymbolicCapability {
    DIFFERENTIATE,
    INTEGRATE,
    FACTOR,
    EXPAND,
    SIMPLIFY,
    SOLVE
}
