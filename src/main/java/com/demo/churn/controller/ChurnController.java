package com.demo.churn.controller;

import com.demo.churn.controller.dto.RefreshStatusResponse;
import com.demo.churn.controller.dto.ScoringRunRequest;
import com.demo.churn.controller.dto.ScoringRunResponse;
import com.demo.churn.repository.ConnectivityRepository;
import com.demo.churn.service.ChurnScoringService;
import com.demo.churn.service.ScoringRunOptions;
import com.demo.churn.service.ScoringRunResult;
import com.demo.churn.service.export.HeaderStyle;
import com.demo.churn.service.export.LoadMode;
import com.demo.churn.service.refresh.RefreshTarget;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;

@RestController
@RequestMapping("/api/churn")
@Validated
@RequiredArgsConstructor
public class ChurnController {

    private final ChurnScoringService scoringService;
    private final ConnectivityRepository connectivity;
    private final Clock clock;

    /** Runs refresh gate + scoring; outputs go to CSV and/or the prediction table as requested */
    @PostMapping("/runs")
    public ScoringRunResponse run(@Valid @RequestBody(required = false) ScoringRunRequest req) {
        if (req == null) req = new ScoringRunRequest();
        if (req.forceRefresh && req.skipRefresh) {
            throw new IllegalArgumentException("forceRefresh and skipRefresh are mutually exclusive");
        }
        ScoringRunOptions options = ScoringRunOptions.builder()
                .top(req.top)
                .asOf(req.asOf)
                .keepAllRows(req.keepAllRows)
                .forceRefresh(req.forceRefresh)
                .skipRefresh(req.skipRefresh)
                .csvOutput(req.csvOutput)
                .rawOutput(req.rawOutput)
                .headers(req.headers == null ? HeaderStyle.FRIENDLY : req.headers)
                .writeTable(req.writeTable)
                .loadMode(req.loadMode == null ? LoadMode.REPLACE : req.loadMode)
                .build();

        ScoringRunResult result = scoringService.run(options);

        ScoringRunResponse res = new ScoringRunResponse();
        res.refreshStatus = result.getRefresh().status();
        res.refreshReason = result.getRefresh().reason();
        res.rows = result.getRows();
        res.modelTrained = result.isModelTrained();
        res.predictedChurn = result.getPredictedChurnCount();
        res.churnedNow = result.getChurnedNowCount();
        res.outputs = result.getOutputs();
        int n = Math.max(0, Math.min(req.previewRows == null ? 20 : req.previewRows, result.getPredictions().size()));
        res.preview = result.getPredictions().subList(0, n);
        return res;
    }

    /** Last recorded run of the feature-table build procedure and whether the next run will refresh */
    @GetMapping("/refresh")
    public RefreshStatusResponse refreshStatus() {
        RefreshTarget target = scoringService.getRefreshTarget();
        Instant last = scoringService.lastRefresh().orElse(null);

        RefreshStatusResponse res = new RefreshStatusResponse();
        res.procedure = target.qualifiedName();
        res.key = target.key();
        res.lastRun = last;
        res.ttlHours = scoringService.ttl().toHours();
        res.due = last == null || !clock.instant().isBefore(last.plus(scoringService.ttl()));
        return res;
    }

    @GetMapping("/connectivity")
    public ConnectivityRepository.ConnectionInfo connectivity() {
        return connectivity.check();
    }
}
