package in.riskgov.domain.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import in.riskgov.domain.governance.LifecycleEvent;
import in.riskgov.domain.governance.PolicyRecord;

import java.util.List;
import java.util.Map;

/**
 * Policy records, running promotion tests keyed by policy id, and the audit trail.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LifecycleState(
    List<PolicyRecord> policies,
    Map<String, SequentialTesterState> testers,
    List<LifecycleEvent> auditTrail
) {
    public LifecycleState {
        policies = policies == null ? List.of() : List.copyOf(policies);
        testers = testers == null ? Map.of() : Map.copyOf(testers);
        auditTrail = auditTrail == null ? List.of() : List.copyOf(auditTrail);
    }
}
