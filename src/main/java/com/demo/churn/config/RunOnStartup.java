package com.demo.churn.config;

import com.demo.churn.service.ChurnScoringService;
import com.demo.churn.service.ScoringRunOptions;
import com.demo.churn.service.ScoringRunResult;
import com.demo.churn.service.export.HeaderStyle;
import com.demo.churn.service.export.LoadMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Batch mode: performs one scoring run as soon as the application is up, using the
 * {@code churn.output.*} defaults. Off unless {@code churn.run-on-startup=true}.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class RunOnStartup {

    private static final AtomicBoolean STARTED = new AtomicBoolean(false);

    private final ChurnScoringService scoringService;

    @Value("${churn.run-on-startup:false}")
    private boolean enabled;

    @Value("${churn.output.csv:customer_churn_predictions.csv}")
    private String csvOutput;

    @Value("${churn.output.raw-csv:}")
    private String rawOutput;

    @Value("${churn.output.headers:FRIENDLY}")
    private HeaderStyle headers;

    @Value("${churn.output.table.enabled:false}")
    private boolean writeTable;

    @Value("${churn.output.table.load-mode:REPLACE}")
    private LoadMode loadMode;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!enabled)
            return;
        // once per process, DevTools restarts included
        if (!STARTED.compareAndSet(false, true))
            return;

        ScoringRunOptions options = ScoringRunOptions.builder()
                .csvOutput(csvOutput)
                .rawOutput(rawOutput)
                .headers(headers)
                .writeTable(writeTable)
                .loadMode(loadMode)
                .build();
        ScoringRunResult result = scoringService.run(options);
        log.info("Startup run scored {} customers ({} predicted to churn, {} churned now) -> {}",
                result.getRows(), result.getPredictedChurnCount(), result.getChurnedNowCount(), result.getOutputs());
    }
}
