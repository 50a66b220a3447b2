package com.arielplatform.common.health;

import com.arielplatform.common.exception.InvalidArgumentException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Error aggregation, issue prioritisation and recovery dispatch for one agent.
 *
 * <h3>Diagnosis</h3>
 * <ul>
 *   <li>Every gauge below {@link HealthConfig#criticalThreshold()} (50) is a critical issue
 *       with severity {@code (50 - value) / 50 x 10}, range (0, 10].</li>
 *   <li>Every error type with at least {@link HealthConfig#recurringMinCount()} (3) unhealed
 *       records is a recurring issue with the mean severity of those records.</li>
 * </ul>
 * Issues are sorted by severity, highest first; ties keep discovery order
 * (critical issues in metric order, then recurring issues in first-seen order).
 *
 * <h3>Healing</h3>
 * The top {@link HealthConfig#maxIssuesPerHeal()} issues are handled one after another.
 * Each gets the first registered strategy whose key occurs in its subject. After all
 * strategies have completed, the error records correlated with the handled issues are
 * marked healed. A failing strategy fails the whole call before the marking pass.
 *
 * <p>Not thread-safe; owned by a single agent.
 */
public class HealthDiagnosticEngine {

    private final HealthConfig config;
    private final StrategyRegistry strategies;
    private final Clock clock;
    private final ErrorLog errorLog;
    private final EnumMap<HealthMetric, Double> metrics = new EnumMap<>(HealthMetric.class);

    private long nextErrorId = 1;

    public HealthDiagnosticEngine(HealthConfig config, StrategyRegistry strategies, Clock clock) {
        this.config     = config;
        this.strategies = strategies;
        this.clock      = clock;
        this.errorLog   = new ErrorLog(config.errorLogCapacity());
        for (HealthMetric m : HealthMetric.values()) {
            metrics.put(m, HealthMetric.MAX);
        }
    }

    /**
     * Appends to the error log and lowers the gauge the type maps to (floored at 0).
     * Types outside the category table are logged without touching any gauge.
     */
    public ErrorRecord logError(String type, double severity, Map<String, Object> details) {
        if (type == null || type.isBlank()) {
            throw new InvalidArgumentException("health", "Error type must not be blank");
        }
        if (severity < 0 || Double.isNaN(severity)) {
            throw new InvalidArgumentException("health", "Severity must be >= 0: " + severity);
        }
        ErrorRecord record = new ErrorRecord(nextErrorId++, type, severity, clock.instant(), details);
        errorLog.append(record);
        HealthMetric.forErrorType(type).ifPresent(m -> adjust(m, -severity));
        return record;
    }

    public List<Issue> diagnose() {
        List<Issue> issues = new ArrayList<>();
        List<ErrorRecord> unhealed = errorLog.records().stream()
            .filter(r -> !r.healed())
            .toList();

        for (HealthMetric metric : HealthMetric.values()) {
            double value = metrics.get(metric);
            if (value < config.criticalThreshold()) {
                List<Long> ids = unhealed.stream()
                    .filter(r -> metric.errorTypes().contains(r.type()))
                    .map(ErrorRecord::id)
                    .toList();
                double severity = (config.criticalThreshold() - value) / config.criticalThreshold() * 10;
                issues.add(new Issue(IssueKind.CRITICAL, metric.key(), severity, null,
                    "Critical " + humanize(metric.key()) + " issue detected", ids));
            }
        }

        Map<String, List<ErrorRecord>> byType = new LinkedHashMap<>();
        for (ErrorRecord r : unhealed) {
            byType.computeIfAbsent(r.type(), t -> new ArrayList<>()).add(r);
        }
        for (Map.Entry<String, List<ErrorRecord>> entry : byType.entrySet()) {
            List<ErrorRecord> records = entry.getValue();
            if (records.size() >= config.recurringMinCount()) {
                double mean = records.stream().mapToDouble(ErrorRecord::severity).average().orElse(0.0);
                issues.add(new Issue(IssueKind.RECURRING, entry.getKey(), mean, records.size(),
                    "Recurring " + humanize(entry.getKey()) + " detected",
                    records.stream().map(ErrorRecord::id).toList()));
            }
        }

        // List.sort is stable, so equal severities keep discovery order
        issues.sort(Comparator.comparingDouble(Issue::severity).reversed());
        return issues;
    }

    /**
     * Diagnoses and runs up to three matching strategies strictly in sequence.
     * Nothing is mutated when there are no issues.
     */
    public Mono<HealingReport> heal(RecoveryContext context) {
        return Mono.defer(() -> {
            List<Issue> issues = diagnose();
            if (issues.isEmpty()) {
                return Mono.just(HealingReport.healthy());
            }
            List<Issue> top = issues.subList(0, Math.min(config.maxIssuesPerHeal(), issues.size()));

            return Flux.fromIterable(top)
                .concatMap(issue -> applyStrategy(issue, context))
                .collectList()
                .map(applied -> {
                    Set<Long> healedIds = new HashSet<>();
                    List<HealingAction> actions = new ArrayList<>();
                    for (AppliedAction a : applied) {
                        healedIds.addAll(a.issue().errorIds());
                        actions.add(a.action());
                    }
                    errorLog.markHealed(healedIds);
                    HealingStatus status = actions.isEmpty()
                        ? HealingStatus.NO_SUITABLE_HEALING_STRATEGY
                        : HealingStatus.HEALING_PERFORMED;
                    return new HealingReport(status, List.copyOf(actions));
                });
        });
    }

    private Mono<AppliedAction> applyStrategy(Issue issue, RecoveryContext context) {
        Optional<RecoveryStrategy> match = strategies.select(issue.subject());
        if (match.isEmpty()) {
            return Mono.empty();
        }
        RecoveryStrategy strategy = match.get();
        return strategy.apply(issue.severity(), context)
            .map(outcome -> {
                adjust(strategy.metric(), outcome.metricGain());
                return new AppliedAction(issue,
                    new HealingAction(issue.label(), strategy.key(), outcome.description()));
            });
    }

    private record AppliedAction(Issue issue, HealingAction action) {}

    /**
     * Stability signal for the phase orchestrator: unhealed records over log capacity.
     */
    public double unhealedErrorRate() {
        return (double) errorLog.unhealedCount() / errorLog.capacity();
    }

    public double metric(HealthMetric metric) {
        return metrics.get(metric);
    }

    public Map<HealthMetric, Double> metrics() {
        return new EnumMap<>(metrics);
    }

    public List<ErrorRecord> errorLog() {
        return errorLog.records();
    }

    private void adjust(HealthMetric metric, double delta) {
        double next = metrics.get(metric) + delta;
        metrics.put(metric, Math.max(HealthMetric.MIN, Math.min(HealthMetric.MAX, next)));
    }

    private static String humanize(String key) {
        return key.replace('_', ' ').toLowerCase(Locale.ROOT);
    }
}
