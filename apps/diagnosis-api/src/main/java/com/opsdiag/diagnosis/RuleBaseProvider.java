package com.opsdiag.diagnosis;

import jakarta.enterprise.context.ApplicationScoped;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.jboss.logging.Logger;

@ApplicationScoped
public class RuleBaseProvider {

    private static final Logger LOGGER = Logger.getLogger("ENGINE.RuleBaseProvider");

    private final AtomicReference<RuleBase> current = new AtomicReference<>(RuleBase.defaults());
    private final AtomicLong versions = new AtomicLong();

    public RuleBase current() {
        return current.get();
    }

    public RuleBase reload(Set<String> disabled, Map<String, Double> weights) {
        RuleBase next = RuleBase.fromCatalogue(
                versions.incrementAndGet(),
                disabled == null ? Set.of() : disabled,
                weights == null ? Map.of() : weights);
        current.set(next);
        LOGGER.infov(
                "[RULES-RELOAD] version={0} enabled={1} disabled={2} overrides={3}",
                next.version(),
                next.rules().size(),
                disabled,
                weights);
        return next;
    }
}
