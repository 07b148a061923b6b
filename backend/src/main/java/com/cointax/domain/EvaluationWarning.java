package com.cointax.domain;

import java.util.Objects;

/**
 * User-visible warning raised during an evaluation. {@code operation} is the ledger event the
 * warning is about, or null for run-level warnings.
 */
public record EvaluationWarning(WarningCode code, String message, Operation operation) {

    public EvaluationWarning {
        Objects.requireNonNull(code, "warning code must not be null");
        Objects.requireNonNull(message, "warning message must not be null");
    }
}
