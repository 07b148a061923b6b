package com.cointax.costbasis;

import com.cointax.domain.EvaluationWarning;
import com.cointax.domain.Operation;
import com.cointax.domain.WarningCode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the data-quality warnings of one evaluation and logs each one at WARN.
 */
@Slf4j
public class EvaluationWarnings {

    private final List<EvaluationWarning> warnings = new ArrayList<>();
    private final Set<WarningCode> raisedOnce = EnumSet.noneOf(WarningCode.class);

    public void add(WarningCode code, String message, Operation operation) {
        warnings.add(new EvaluationWarning(code, message, operation));
        if (operation != null) {
            log.warn("{}: {} (see {})", code, message, operation.describeSource());
        } else {
            log.warn("{}: {}", code, message);
        }
    }

    /** Records the warning only the first time its code is raised. */
    public void addOnce(WarningCode code, String message, Operation operation) {
        if (raisedOnce.add(code)) {
            add(code, message, operation);
        }
    }

    public List<EvaluationWarning> list() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean contains(WarningCode code) {
        return warnings.stream().anyMatch(w -> w.code() == code);
    }
}
