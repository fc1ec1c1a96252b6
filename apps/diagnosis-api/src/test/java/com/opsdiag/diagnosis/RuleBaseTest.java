package com.opsdiag.diagnosis;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RuleBaseTest {

    @Test
    void defaultsRunEveryRuleInPriorityOrder() {
        List<String> ids = RuleBase.defaults().rules().stream().map(DiagnosisRule::id).toList();

        assertEquals(List.of(
                "deployment-regression",
                "dependency-outage",
                "resource-exhaustion",
                "thread-pool-exhaustion",
                "upstream-timeout",
                "configuration-missing",
                "organic-load"), ids);
    }

    @Test
    void catalogueRejectsUnknownRulesAndWeightsOutOfRange() {
        assertThrows(IllegalArgumentException.class,
                () -> RuleBase.fromCatalogue(1, Set.of("no-such-rule"), Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> RuleBase.fromCatalogue(1, Set.of(), Map.of("organic-load", 1.5)));
        assertThrows(IllegalArgumentException.class,
                () -> RuleBase.fromCatalogue(1, Set.of(), Map.of("ghost", 0.5)));
    }

    @Test
    void providerSwapsTheRuleBaseAtomically() {
        RuleBaseProvider provider = new RuleBaseProvider();
        RuleBase before = provider.current();

        RuleBase after = provider.reload(Set.of("organic-load"), Map.of("upstream-timeout", 0.3));

        assertEquals(7, before.rules().size());
        assertEquals(6, after.rules().size());
        assertEquals(after, provider.current());
        DiagnosisRule timeout = after.rules().stream().filter(r -> r.id().equals("upstream-timeout")).findFirst().orElseThrow();
        assertEquals(0.3, after.weightOf(timeout), 1e-9);
        assertEquals(0.65, before.weightOf(timeout), 1e-9);
    }

    @Test
    void rejectedReloadKeepsTheCurrentRuleBase() {
        RuleBaseProvider provider = new RuleBaseProvider();
        RuleBase before = provider.current();

        assertThrows(IllegalArgumentException.class, () -> provider.reload(Set.of("bogus"), null));

        assertEquals(before, provider.current());
    }
}
