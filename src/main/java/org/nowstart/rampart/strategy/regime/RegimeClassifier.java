package org.nowstart.rampart.strategy.regime;

import java.util.List;
import org.nowstart.rampart.data.dto.Bar;
import org.nowstart.rampart.data.type.MarketRegime;

@FunctionalInterface
public interface RegimeClassifier {

    /**
     * @param history oldest-first bars up to and including the current bar
     */
    MarketRegime classify(List<Bar> history);
}
