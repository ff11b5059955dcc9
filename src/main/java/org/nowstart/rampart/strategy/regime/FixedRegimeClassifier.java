package org.nowstart.rampart.strategy.regime;

import java.util.List;
import org.nowstart.rampart.data.dto.Bar;
import org.nowstart.rampart.data.type.MarketRegime;

public record FixedRegimeClassifier(MarketRegime regime) implements RegimeClassifier {

    public FixedRegimeClassifier {
        if (regime == null) {
            throw new IllegalArgumentException("regime is required");
        }
    }

    @Override
    public MarketRegime classify(List<Bar> history) {
        return regime;
    }
}
