package com.mathrok.engine.ast;

public enum Associativity {
    LEFT,
    RIGHT
}
