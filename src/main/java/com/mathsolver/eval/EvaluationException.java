package com.mathsolver.eval;

import com.mathsolver.parser.PositionedException;
import com.mathsolver.parser.SourcePosition;

/**
 * Well-formed input that cannot be evaluated: undefined variable, division by zero,
 * non-integer factorial or iteration bound, function domain violation, wrong
 * argument count or unknown function.
 */
public class EvaluationException extends PositionedException {
    public EvaluationException(String detail, SourcePosition position) {
        super(detail, position);
    }

    public EvaluationException(String detail, SourcePosition position, Throwable cause) {
        super(detail, position, cause);
    }
}
