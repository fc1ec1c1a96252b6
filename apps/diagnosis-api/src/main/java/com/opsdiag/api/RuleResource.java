package com.opsdiag.api;

import com.opsdiag.diagnosis.DiagnosisRule;
import com.opsdiag.diagnosis.RuleBase;
import com.opsdiag.diagnosis.RuleBaseProvider;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Path("/v1/rules")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class RuleResource {

    public static record RuleView(String id, String title, int priority, double baseWeight, double effectiveWeight) {
    }

    public static record RuleBaseView(long version, List<RuleView> enabled, Set<String> catalogue) {
    }

    /** Rules listed in {@code disabled} are left out; {@code weights} override base weights. */
    public static record RuleBaseUpdate(Set<String> disabled, Map<String, Double> weights) {
    }

    @Inject
    RuleBaseProvider rules;

    @GET
    public RuleBaseView current() {
        return view(rules.current());
    }

    @PUT
    public RuleBaseView replace(RuleBaseUpdate update) {
        RuleBase next = update == null
                ? rules.reload(Set.of(), Map.of())
                : rules.reload(update.disabled(), update.weights());
        return view(next);
    }

    private static RuleBaseView view(RuleBase base) {
        List<RuleView> enabled = base.rules().stream()
                .map(rule -> toView(base, rule))
                .toList();
        return new RuleBaseView(base.version(), enabled, RuleBase.catalogueIds());
    }

    private static RuleView toView(RuleBase base, DiagnosisRule rule) {
        return new RuleView(rule.id(), rule.title(), rule.priority(), rule.baseWeight(), base.weightOf(rule));
    }
}
