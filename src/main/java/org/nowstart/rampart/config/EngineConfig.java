package org.nowstart.rampart.config;

import org.nowstart.rampart.data.property.RegimeProperties;
import org.nowstart.rampart.strategy.regime.EmaBandRegimeClassifier;
import org.nowstart.rampart.strategy.regime.RegimeClassifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {

    @Bean
    public RegimeClassifier regimeClassifier(RegimeProperties regimeProperties) {
        return new EmaBandRegimeClassifier(regimeProperties);
    }
}
