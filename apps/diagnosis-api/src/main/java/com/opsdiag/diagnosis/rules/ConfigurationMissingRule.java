package com.opsdiag.diagnosis.rules;

import com.opsdiag.diagnosis.DiagnosisContext;
import com.opsdiag.diagnosis.DiagnosisRule;
import com.opsdiag.diagnosis.RuleMatch;
import com.opsdiag.model.Signal;
import java.util.List;
import java.util.Optional;

public class ConfigurationMissingRule implements DiagnosisRule {

    @Override
    public String id() {
        return "configuration-missing";
    }

    @Override
    public String title() {
        return "missing configuration";
    }

    @Override
    public int priority() {
        return 6;
    }

    @Override
    public double baseWeight() {
        return 0.6;
    }

    @Override
    public Optional<RuleMatch> evaluate(DiagnosisContext context) {
        List<Signal> missing = context.matching(SignalPatterns.RE_CONFIG_MISSING);
        if (missing.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new RuleMatch(
                missing.size() + " signal(s) report missing ConfigMaps, secrets or configuration properties",
                missing,
                "Confirm the required ConfigMaps/Secrets exist and are referenced by the deployment",
                context.window()));
    }
}
