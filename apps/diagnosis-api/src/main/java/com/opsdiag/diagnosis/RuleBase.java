package com.opsdiag.diagnosis;

import com.opsdiag.diagnosis.rules.ConfigurationMissingRule;
import com.opsdiag.diagnosis.rules.DependencyOutageRule;
import com.opsdiag.diagnosis.rules.DeploymentRegressionRule;
import com.opsdiag.diagnosis.rules.OrganicLoadRule;
import com.opsdiag.diagnosis.rules.ResourceExhaustionRule;
import com.opsdiag.diagnosis.rules.ThreadPoolExhaustionRule;
import com.opsdiag.diagnosis.rules.UpstreamTimeoutRule;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable, ordered set of diagnosis rules with optional base-weight overrides.
 */
public final class RuleBase {

    private static final List<DiagnosisRule> BUILTIN = List.of(
            new DeploymentRegressionRule(),
            new DependencyOutageRule(),
            new ResourceExhaustionRule(),
            new ThreadPoolExhaustionRule(),
            new UpstreamTimeoutRule(),
            new ConfigurationMissingRule(),
            new OrganicLoadRule());

    private final long version;
    private final List<DiagnosisRule> rules;
    private final Map<String, Double> weightOverrides;

    public RuleBase(long version, List<DiagnosisRule> rules, Map<String, Double> weightOverrides) {
        this.version = version;
        this.rules = rules.stream()
                .sorted(Comparator.comparingInt(DiagnosisRule::priority))
                .toList();
        this.weightOverrides = Map.copyOf(weightOverrides);
    }

    public static RuleBase defaults() {
        return new RuleBase(0, BUILTIN, Map.of());
    }

    /**
     * Builds a rule base from the built-in catalogue.
     *
     * @throws IllegalArgumentException for unknown rule ids or weights outside {@code [0, 1]}
     */
    public static RuleBase fromCatalogue(long version, Set<String> disabled, Map<String, Double> weights) {
        Set<String> known = catalogueIds();
        for (String id : disabled) {
            if (!known.contains(id)) {
                throw new IllegalArgumentException("unknown rule: " + id);
            }
        }
        weights.forEach((id, weight) -> {
            if (!known.contains(id)) {
                throw new IllegalArgumentException("unknown rule: " + id);
            }
            if (weight == null || weight < 0.0 || weight > 1.0) {
                throw new IllegalArgumentException("weight for " + id + " must be within [0, 1]");
            }
        });
        List<DiagnosisRule> enabled = BUILTIN.stream()
                .filter(rule -> !disabled.contains(rule.id()))
                .toList();
        return new RuleBase(version, enabled, weights);
    }

    public static Set<String> catalogueIds() {
        return BUILTIN.stream().map(DiagnosisRule::id).collect(Collectors.toUnmodifiableSet());
    }

    public long version() {
        return version;
    }

    public List<DiagnosisRule> rules() {
        return rules;
    }

    public double weightOf(DiagnosisRule rule) {
        return weightOverrides.getOrDefault(rule.id(), rule.baseWeight());
    }
}
