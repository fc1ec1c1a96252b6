package com.opsdiag.diagnosis;

import java.util.Optional;

public interface DiagnosisRule {

    String id();

    String title();

    /** Lower values win ties on confidence. */
    int priority();

    double baseWeight();

    Optional<RuleMatch> evaluate(DiagnosisContext context);
}
