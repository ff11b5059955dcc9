package org.nowstart.rampart.engine;

import org.nowstart.rampart.data.dto.AccountSnapshot;
import org.nowstart.rampart.data.dto.Engagement;
import org.nowstart.rampart.data.dto.TriageDecision;
import org.nowstart.rampart.data.property.RiskBrainConfig;
import org.nowstart.rampart.data.type.MarketRegime;
import org.nowstart.rampart.data.type.TriageVerdict;

/**
 * Turns account drawdown and market regime into an allow/shrink/skip decision for one engagement.
 * Reads the account, never writes it.
 */
public class RiskBrain {

    public static final String REASON_NONE = "NONE";
    public static final String REASON_MAX_OPEN_POSITIONS = "MAX_OPEN_POSITIONS";
    public static final String REASON_DAILY_LOSS_BREAKER = "DAILY_LOSS_BREAKER";
    public static final String REASON_REWARD_RISK_TOO_LOW = "REWARD_RISK_TOO_LOW";
    public static final String REASON_SIZING_BELOW_FLOOR = "SIZING_BELOW_FLOOR";
    public static final String REASON_SIZE_TOO_SMALL = "SIZE_TOO_SMALL";
    public static final String REASON_MARGIN_CAP = "MARGIN_CAP";

    private static final double FULL_SIZE_TOLERANCE = 1e-9;

    private final RiskBrainConfig config;
    private final RiskLadder ladder;

    public RiskBrain(RiskBrainConfig config) {
        this.config = config;
        this.ladder = new RiskLadder(config.ladder());
    }

    public double ladderMultiplier(AccountSnapshot account) {
        return ladder.multiplierFor(account == null ? 0.0 : account.drawdown());
    }

    public double regimeMultiplier(MarketRegime regime) {
        MarketRegime resolved = regime == null ? MarketRegime.TRIAGE : regime;
        return config.regimeMultipliers().getOrDefault(resolved, 1.0);
    }

    public TriageDecision triage(AccountSnapshot account, MarketRegime regime, Engagement engagement, int openPositions) {
        return triage(account, regime, engagement, openPositions, 0.0);
    }

    /**
     * @param openNotional sum of remaining size x entry price over the positions already open
     */
    public TriageDecision triage(
            AccountSnapshot account,
            MarketRegime regime,
            Engagement engagement,
            int openPositions,
            double openNotional
    ) {
        double ladderMultiplier = ladderMultiplier(account);
        double regimeMultiplier = regimeMultiplier(regime);

        if (config.maxOpenPositions() > 0 && openPositions >= config.maxOpenPositions()) {
            return TriageDecision.skip(ladderMultiplier, regimeMultiplier, REASON_MAX_OPEN_POSITIONS);
        }
        if (account != null && config.maxDailyLossFraction() > 0.0
                && account.dailyLoss() > config.maxDailyLossFraction()) {
            return TriageDecision.skip(ladderMultiplier, regimeMultiplier, REASON_DAILY_LOSS_BREAKER);
        }
        if (config.minRewardRisk() > 0.0 && rewardRisk(engagement) < config.minRewardRisk()) {
            return TriageDecision.skip(ladderMultiplier, regimeMultiplier, REASON_REWARD_RISK_TOO_LOW);
        }

        double product = ladderMultiplier * regimeMultiplier;
        if (product <= 0.0 || product < config.skipFloor()) {
            return TriageDecision.skip(ladderMultiplier, regimeMultiplier, REASON_SIZING_BELOW_FLOOR);
        }

        TriageVerdict verdict = Math.abs(product - 1.0) <= FULL_SIZE_TOLERANCE
                ? TriageVerdict.ALLOW_FULL
                : TriageVerdict.ALLOW_REDUCED;
        double size = verdict == TriageVerdict.ALLOW_FULL
                ? engagement.requestedSize()
                : engagement.requestedSize() * product;
        if (!(size > 0.0)) {
            return TriageDecision.skip(ladderMultiplier, regimeMultiplier, REASON_SIZING_BELOW_FLOOR);
        }

        double notional = size * engagement.entryPrice();
        if (config.minNotional() > 0.0 && notional < config.minNotional()) {
            return TriageDecision.skip(ladderMultiplier, regimeMultiplier, REASON_SIZE_TOO_SMALL);
        }
        if (config.maxMarginUtilization() > 0.0 && exceedsMarginCap(account, openNotional + notional)) {
            return TriageDecision.skip(ladderMultiplier, regimeMultiplier, REASON_MARGIN_CAP);
        }
        return new TriageDecision(verdict, ladderMultiplier, regimeMultiplier, product, size, REASON_NONE);
    }

    private boolean exceedsMarginCap(AccountSnapshot account, double notional) {
        if (account == null || account.equity() <= 0.0) {
            return true;
        }
        return notional / account.equity() > config.maxMarginUtilization();
    }

    private double rewardRisk(Engagement engagement) {
        if (engagement.stopLossPips() <= 0.0) {
            return 0.0;
        }
        return engagement.furthestTakeProfitPips() / engagement.stopLossPips();
    }
}
