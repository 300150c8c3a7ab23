package in.riskgov.application.port.input;

import in.riskgov.domain.acceptance.CycleDecision;
import in.riskgov.domain.acceptance.GuardEvaluation;
import in.riskgov.domain.acceptance.Posture;
import in.riskgov.domain.execution.ExecutionDecision;
import in.riskgov.domain.forecast.Forecast;
import in.riskgov.domain.forecast.GroundTruth;
import in.riskgov.domain.governance.GovernanceDecision;
import in.riskgov.domain.governance.PolicyMetric;
import in.riskgov.domain.governance.PolicyRecord;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for the forecasting and execution layers.
 */
public interface RiskDecisionService {

    /**
     * Run one decision cycle for a stream, creating (or restoring) the stream on first use.
     */
    CycleDecision process(String streamId, Forecast forecast);

    /**
     * @return true if the realised value fell inside its interval
     */
    boolean onGroundTruth(String streamId, GroundTruth truth);

    /**
     * @return the governance decision when the policy is under test
     */
    Optional<GovernanceDecision> onPolicyMetric(PolicyMetric metric);

    PolicyRecord registerPolicy(String policyId, String version);

    PolicyRecord registerLivePolicy(String policyId, String version);

    PolicyRecord startCanary(String policyId);

    /**
     * Gate a policy's order by posture, guards and lifecycle stage.
     */
    ExecutionDecision sizeFor(String policyId, Posture posture, List<GuardEvaluation> evaluations, double baseNotional);
}
