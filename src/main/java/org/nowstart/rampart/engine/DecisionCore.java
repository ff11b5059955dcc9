package org.nowstart.rampart.engine;

import org.nowstart.rampart.data.property.CostModelConfig;
import org.nowstart.rampart.data.property.RiskBrainConfig;
import org.nowstart.rampart.data.property.SafetyLawConfig;
import org.nowstart.rampart.execution.ExecutionSink;

/**
 * The single decision path shared by backtests, packs and the live router. Only the account, the execution
 * sink and the journal differ between callers.
 */
public class DecisionCore {

    private final PipScale pipScale;
    private final SafetyLawEvaluator laws;
    private final RiskBrain riskBrain;
    private final CostModel costModel;

    public DecisionCore(double pipSize, SafetyLawConfig safety, RiskBrainConfig risk, CostModelConfig cost) {
        this.pipScale = new PipScale(pipSize);
        this.laws = new SafetyLawEvaluator(safety, pipScale);
        this.riskBrain = new RiskBrain(risk);
        this.costModel = new LinearCostModel(cost, pipScale);
    }

    public PositionLifecycleManager newLifecycle(String instrument, AccountState account, ExecutionSink sink, DecisionJournal journal) {
        return new PositionLifecycleManager(instrument, pipScale, laws, riskBrain, costModel, account, sink, journal);
    }

    public PipScale pipScale() {
        return pipScale;
    }

    public SafetyLawConfig safety() {
        return laws.config();
    }
}
