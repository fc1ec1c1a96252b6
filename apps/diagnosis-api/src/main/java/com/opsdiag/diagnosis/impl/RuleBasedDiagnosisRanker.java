package com.opsdiag.diagnosis.impl;

import com.opsdiag.diagnosis.DiagnosisContext;
import com.opsdiag.diagnosis.DiagnosisRanker;
import com.opsdiag.diagnosis.DiagnosisRule;
import com.opsdiag.diagnosis.RuleBase;
import com.opsdiag.diagnosis.RuleBaseProvider;
import com.opsdiag.diagnosis.RuleMatch;
import com.opsdiag.model.Incident;
import com.opsdiag.model.RootCauseHypothesis;
import com.opsdiag.model.Signal;
import com.opsdiag.topology.TopologySnapshot;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class RuleBasedDiagnosisRanker implements DiagnosisRanker {

    private static final Logger LOGGER = Logger.getLogger("ENGINE.DiagnosisRanker");

    static final double RECENCY_SHARE = 0.30;
    static final double EVIDENCE_SHARE = 0.15;
    static final double FLOOR_SHARE = 1.0 - RECENCY_SHARE - EVIDENCE_SHARE;
    static final int INDEPENDENT_KINDS_FOR_FULL_EVIDENCE = 3;

    @Inject
    RuleBaseProvider rules;

    @Inject
    Clock clock;

    @ConfigProperty(name = "engine.correlation.window", defaultValue = "PT30M")
    Duration window;

    @ConfigProperty(name = "engine.correlation.deployment-window", defaultValue = "PT1H")
    Duration deploymentWindow;

    @ConfigProperty(name = "engine.correlation.hops", defaultValue = "2")
    int hops;

    @PostConstruct
    void init() {
        LOGGER.infov(
                "[INIT] RuleBasedDiagnosisRanker ready. rules={0} version={1}",
                rules.current().rules().size(),
                rules.current().version());
    }

    @Override
    public List<RootCauseHypothesis> diagnose(Incident incident, TopologySnapshot topology) {
        RuleBase ruleBase = rules.current();
        DiagnosisContext context = new DiagnosisContext(
                incident.triggerSignal(),
                incident.candidateSignals(),
                topology,
                window,
                deploymentWindow,
                hops);

        List<RootCauseHypothesis> hypotheses = new ArrayList<>();
        for (DiagnosisRule rule : ruleBase.rules()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("diagnosis " + incident.id() + " cancelled");
            }
            Optional<RuleMatch> match;
            try {
                match = rule.evaluate(context);
            } catch (RuntimeException e) {
                LOGGER.errorf(e, "[RULE-ERROR] requestId=%s rule=%s skipped", incident.id(), rule.id());
                continue;
            }
            match.map(m -> toHypothesis(rule, ruleBase.weightOf(rule), m, incident.triggerSignal()))
                    .ifPresent(hypotheses::add);
        }
        hypotheses.sort(RootCauseHypothesis.RANKING);

        if (!incident.attachDiagnosis(hypotheses, clock.instant())) {
            LOGGER.infov("[DIAGNOSE-LATE] requestId={0} incident sealed; hypotheses not attached", incident.id());
        }
        LOGGER.infov(
                "[DIAGNOSE] requestId={0} candidates={1} hypotheses={2} top={3} ruleBaseVersion={4}",
                incident.id(),
                context.candidates().size(),
                hypotheses.size(),
                hypotheses.isEmpty() ? "<none>" : hypotheses.get(0).ruleId(),
                ruleBase.version());
        return List.copyOf(hypotheses);
    }

    RootCauseHypothesis toHypothesis(DiagnosisRule rule, double baseWeight, RuleMatch match, Signal trigger) {
        double confidence = confidence(baseWeight, match, trigger.timestamp());
        return new RootCauseHypothesis(
                rule.id(),
                rule.title(),
                match.explanation(),
                confidence,
                rule.priority(),
                match.supportingSignals(),
                match.recommendedMitigation());
    }

    static double confidence(double baseWeight, RuleMatch match, Instant triggerTime) {
        double recency = recency(match, triggerTime);
        long kinds = match.supportingSignals().stream().map(Signal::kind).distinct().count();
        double evidence = Math.min(1.0, (double) kinds / INDEPENDENT_KINDS_FOR_FULL_EVIDENCE);
        double score = baseWeight * (FLOOR_SHARE + RECENCY_SHARE * recency + EVIDENCE_SHARE * evidence);
        return Math.max(0.0, Math.min(1.0, score));
    }

    private static double recency(RuleMatch match, Instant triggerTime) {
        Optional<Instant> latest = match.supportingSignals().stream()
                .map(Signal::timestamp)
                .max(Instant::compareTo);
        if (latest.isEmpty() || match.horizon() == null || match.horizon().isZero()) {
            return 0.0;
        }
        long ageMillis = Math.max(0, Duration.between(latest.get(), triggerTime).toMillis());
        double ratio = (double) ageMillis / match.horizon().toMillis();
        return Math.max(0.0, 1.0 - ratio);
    }
}
