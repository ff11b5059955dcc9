package org.nowstart.rampart.strategy;

import java.util.List;
import org.nowstart.rampart.data.dto.AccountSnapshot;
import org.nowstart.rampart.data.dto.Bar;
import org.nowstart.rampart.data.dto.PositionSnapshot;
import org.nowstart.rampart.data.type.MarketRegime;

public record StrategyContext(
        String instrument,
        Bar bar,
        List<Bar> history,
        List<PositionSnapshot> openPositions,
        AccountSnapshot account,
        MarketRegime regime
) {
}
