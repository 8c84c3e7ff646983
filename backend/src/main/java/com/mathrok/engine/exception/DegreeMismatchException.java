package com.mathrok.engine.exception;

import java.util.List;

/**
 * The equation has a higher degree in the target variable than the requested solver supports.
 */
public class DegreeMismatchException extends MathException {

    private final int supportedDegree;
    private final int actualDegree;

    public DegreeMismatchException(String variable, int supportedDegree, int actualDegree) {
        super(ErrorType.DEGREE_MISMATCH,
                "Equation has degree " + actualDegree + " in " + variable + ", solver supports at most " + supportedDegree,
                null, List.of());
        this.supportedDegree = supportedDegree;
        this.actualDegree = actualDegree;
    }

    public int getSupportedDegree() {
        return supportedDegree;
    }

    public int getActualDegree() {
        return actualDegree;
    }
}
