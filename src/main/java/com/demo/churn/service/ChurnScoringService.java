package com.demo.churn.service;

import com.demo.churn.repository.PredictionRepository;
import com.demo.churn.service.dto.ChurnPrediction;
import com.demo.churn.service.error.RefreshFailedException;
import com.demo.churn.service.explain.ContributionExplainer;
import com.demo.churn.service.explain.RowExplanation;
import com.demo.churn.service.export.CsvPredictionExporter;
import com.demo.churn.service.export.RawRecordExporter;
import com.demo.churn.service.features.ChurnRecord;
import com.demo.churn.service.features.ChurnRecordSource;
import com.demo.churn.service.features.FeatureMatrix;
import com.demo.churn.service.features.FeatureNormalizer;
import com.demo.churn.service.features.RecordDeduplicator;
import com.demo.churn.service.model.ChurnModel;
import com.demo.churn.service.model.ModelRun;
import com.demo.churn.service.refresh.RefreshGate;
import com.demo.churn.service.refresh.RefreshGateState;
import com.demo.churn.service.refresh.RefreshGateStateStore;
import com.demo.churn.service.refresh.RefreshOutcome;
import com.demo.churn.service.refresh.RefreshTarget;
import com.demo.churn.service.rules.BusinessRuleEvaluator;
import com.demo.churn.service.rules.BusinessRuleOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChurnScoringService {

    private final ChurnRecordSource recordSource;
    private final RecordDeduplicator deduplicator;
    private final FeatureNormalizer normalizer;
    private final ChurnModel model;
    private final ContributionExplainer explainer;
    private final BusinessRuleEvaluator businessRules;

    private final RefreshGate refreshGate;
    private final RefreshGateStateStore gateStore;
    private final RefreshTarget refreshTarget;

    private final PredictionRepository predictionRepository;
    private final Clock clock;

    @Value("${churn.source.label-column:churned_hard90}")
    private String labelColumn;

    @Value("${churn.refresh.ttl-hours:24}")
    private long ttlHours;

    @Value("${churn.refresh.abort-on-failure:false}")
    private boolean abortOnRefreshFailure;

    @Value("${churn.output.dir:.}")
    private String outputDir;

    /** One full run: refresh gate, fetch, score, explain, business rule, then the requested outputs. */
    public synchronized ScoringRunResult run(ScoringRunOptions options) {
        Path csvTarget = resolveOutput(options.getCsvOutput());
        Path rawTarget = resolveOutput(options.getRawOutput());

        RefreshOutcome refresh = options.isSkipRefresh()
                ? RefreshOutcome.skipped("skipped")
                : refresh(options.isForceRefresh());
        log.info("Stored procedure {}: {} ({})", refresh.status(), refreshTarget.qualifiedName(), refresh.reason());
        if (refresh.failed()) {
            if (abortOnRefreshFailure) throw new RefreshFailedException(refresh);
            log.warn("Continuing with the data currently in the feature table");
        }

        String label = labelColumn();
        List<ChurnRecord> records = recordSource.fetch(options.getTop(), label);
        records = deduplicator.filterAsOf(records, options.getAsOf());
        if (!options.isKeepAllRows()) {
            records = deduplicator.latestPerCustomer(records);
        }
        log.info("Scoring {} customer rows", records.size());

        List<String> outputs = new ArrayList<>();
        if (rawTarget != null) {
            outputs.add(new RawRecordExporter(rawTarget).write(records, label));
        }

        List<ChurnPrediction> predictions = score(records, label != null);

        if (csvTarget != null) {
            outputs.add(new CsvPredictionExporter(csvTarget, options.getHeaders())
                    .write(predictions, label != null));
        }
        if (options.isWriteTable()) {
            outputs.add(predictionRepository.save(predictions, options.getLoadMode()));
        }

        return ScoringRunResult.builder()
                .refresh(refresh)
                .rows(predictions.size())
                .modelTrained(label != null && !predictions.isEmpty())
                .predictedChurnCount(predictions.stream().filter(p -> p.getPredictedChurn() == 1).count())
                .churnedNowCount(predictions.stream().filter(ChurnPrediction::isChurnedNow).count())
                .outputs(outputs)
                .predictions(predictions)
                .build();
    }

    /**
     * Scores already-deduplicated records. Model output and the business rule are
     * computed independently and both kept.
     */
    public List<ChurnPrediction> score(List<ChurnRecord> records, boolean labelled) {
        if (records.isEmpty()) {
            return List.of();
        }
        FeatureMatrix matrix = normalizer.normalize(records);
        int[] labels = labelled ? normalizer.labels(records) : null;

        ModelRun run = model.fitPredict(matrix, labels);
        ContributionExplainer.Explanations why = explainer.explain(run, matrix, labels);
        long degraded = why.predicted().stream().filter(RowExplanation::degraded).count();
        if (degraded > 0) {
            log.warn("{} of {} rows fell back to a generic reason", degraded, records.size());
        }

        LocalDate today = LocalDate.now(clock);
        LocalDateTime createdOn = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        List<ChurnPrediction> out = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            ChurnRecord r = records.get(i);
            BusinessRuleOutcome rule = businessRules.evaluate(
                    r.asOfDate(), BusinessRuleEvaluator.isInGrace(r.renewalGrace()), today);
            double p = run.probability(i);

            ChurnPrediction.ChurnPredictionBuilder b = ChurnPrediction.builder()
                    .customerId(r.customerId())
                    .snapshotDate(r.asOfDate())
                    .daysSinceLastPurchaseToday(rule.daysSincePurchase())
                    .churnedNow(rule.churnedNow())
                    .churnedNowReason(rule.reason())
                    .predictedChurn(run.predictedLabel(i))
                    .churnProbability(p)
                    .churnProbabilityPct(ChurnPrediction.toPercent(p))
                    .predictedChurnReason(why.predicted().get(i).text())
                    .createdOn(createdOn);
            if (labels != null) {
                b.actualChurned(labels[i]).actualChurnReason(why.actual().get(i).text());
            }
            out.add(b.build());
        }
        return out;
    }

    /** Runs the upstream refresh through the gate and persists the gate state when it moved. */
    public RefreshOutcome refresh(boolean force) {
        RefreshGateState state = gateStore.load();
        RefreshGate.Decision decision = refreshGate.maybeRun(state, refreshTarget, force, ttl());
        if (decision.outcome().ran()) {
            try {
                gateStore.save(decision.state());
            } catch (UncheckedIOException e) {
                log.error("Refresh ran but its state could not be saved; the next run will refresh again", e);
            }
        }
        return decision.outcome();
    }

    /**
     * Output files are always placed under {@code churn.output.dir}. Absolute paths and
     * paths that leave that directory are rejected.
     */
    Path resolveOutput(String requested) {
        if (requested == null || requested.isBlank()) return null;
        Path base = Path.of(outputDir).toAbsolutePath().normalize();
        Path relative;
        try {
            relative = Path.of(requested.trim());
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid output path: " + requested);
        }
        if (relative.isAbsolute() || relative.getRoot() != null) {
            throw new IllegalArgumentException("Output path must be relative to the output directory: " + requested);
        }
        Path target = base.resolve(relative).normalize();
        if (!target.startsWith(base) || target.equals(base)) {
            throw new IllegalArgumentException("Output path escapes the output directory: " + requested);
        }
        return target;
    }

    public Optional<Instant> lastRefresh() {
        return gateStore.load().lastRun(refreshTarget.key());
    }

    public RefreshTarget getRefreshTarget() {
        return refreshTarget;
    }

    public Duration ttl() {
        return Duration.ofHours(ttlHours);
    }

    private String labelColumn() {
        return labelColumn == null || labelColumn.isBlank() ? null : labelColumn.trim();
    }
}
