package org.nowstart.rampart.runner;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.rampart.data.dto.Bar;
import org.nowstart.rampart.data.dto.PackResult;
import org.nowstart.rampart.data.dto.ScheduledEngagement;
import org.nowstart.rampart.data.property.BatchProperties;
import org.nowstart.rampart.data.property.SimulationProperties;
import org.nowstart.rampart.service.CsvMarketDataService;
import org.nowstart.rampart.service.PackBatchService;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class BatchRunner implements ApplicationRunner {

    private final BatchProperties config;
    private final SimulationProperties simulationProperties;
    private final CsvMarketDataService csvMarketDataService;
    private final PackBatchService packBatchService;

    @Override
    public void run(ApplicationArguments args) {
        if (!config.enabled()) {
            log.info("rampart.batch.enabled=false; pass --rampart.batch.enabled=true to run");
            return;
        }
        if (config.barsCsv().isEmpty()) {
            throw new IllegalStateException("rampart.batch.bars-csv is required when the batch is enabled");
        }

        logSection("PACK BATCH START");
        log.info(
                "[Overview] instrument={} barsCsv={} engagementsCsv={} combinations={} topK={} parallelism={} progressLogSec={}",
                simulationProperties.instrument(),
                config.barsCsv(),
                config.engagementsCsv(),
                config.combinationCount(),
                config.topK(),
                config.parallelism(),
                config.progressLogSeconds()
        );

        List<Bar> bars = csvMarketDataService.loadBars(Path.of(config.barsCsv()));
        List<ScheduledEngagement> engagements = config.engagementsCsv().isEmpty()
                ? List.of()
                : csvMarketDataService.loadEngagements(Path.of(config.engagementsCsv()));
        log.info("[Overview] loaded bars={} engagements={}", bars.size(), engagements.size());

        logSection("PACK RANKING");
        List<PackResult> rows = packBatchService.run(simulationProperties.instrument(), bars, engagements, config);
        if (rows.isEmpty()) {
            throw new IllegalStateException("Pack batch returned no rows");
        }
        for (int i = 0; i < rows.size(); i++) {
            PackResult row = rows.get(i);
            log.info(
                    "[Pack {}/{}] pnlToDrawdown={} netPnl={} mdd={} final={} trades={} maxSlPips={} winnerRr={} zombieBars={} zombieStepPips={}",
                    i + 1,
                    rows.size(),
                    row.pnlToDrawdown(),
                    row.netPnl(),
                    formatPercent(row.maxDrawdown()),
                    row.finalEquity(),
                    row.tradeCount(),
                    row.safety().maxStopLossPips(),
                    row.safety().winnerRewardRiskThreshold(),
                    row.safety().zombieStalenessBars(),
                    row.safety().zombieStepPips()
            );
        }
        logSection("PACK BATCH END");
    }

    private void logSection(String title) {
        log.info("========== {} ==========", title);
    }

    private String formatPercent(double value) {
        if (!Double.isFinite(value)) {
            return "NaN";
        }
        return String.format(Locale.US, "%.2f%%", value * 100.0);
    }
}
