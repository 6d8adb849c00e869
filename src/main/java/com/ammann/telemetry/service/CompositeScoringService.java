/* (C)2026 */
package com.ammann.telemetry.service;

import com.ammann.telemetry.dto.AnomalyVerdictDTO;
import com.ammann.telemetry.dto.CompositeAnomalyDTO;
import com.ammann.telemetry.dto.MetricDeviationDTO;
import com.ammann.telemetry.enumeration.AnomalyPattern;
import com.ammann.telemetry.enumeration.MetricType;
import com.ammann.telemetry.enumeration.Severity;
import com.ammann.telemetry.exception.ValidationException;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Aggregates the simultaneously elevated metrics of an entity into one composite
 * anomaly.
 *
 * <p>A metric is elevated when {@code |z| > analytics.composite.elevated-threshold}, a
 * looser gate than the standalone anomaly threshold so that mild concurrent deviations
 * also count. The composite score is the root mean square of the elevated |z| values,
 * which lets one severe metric outweigh several mild ones. Known patterns are matched by
 * {@link #PATTERN_RULES} in order, the first match wins.
 */
@ApplicationScoped
public class CompositeScoringService
{

    private static final Logger LOG = Logger.getLogger(CompositeScoringService.class);

    static final double DEFAULT_ELEVATED_THRESHOLD = 1.0;
    static final double DEFAULT_PATTERN_THRESHOLD = 2.0;
    static final double DEFAULT_MIN_COMPOSITE_SCORE = 2.0;

    /** Pattern rules evaluated in order; the first matching rule names the pattern. */
    static final List<PatternRule> PATTERN_RULES = List.of(
            new PatternRule(s -> s.cpuHigh() && s.memoryHigh(), AnomalyPattern.RESOURCE_EXHAUSTION),
            new PatternRule(s -> !s.cpuHigh() && s.memoryHigh(), AnomalyPattern.MEMORY_LEAK_SUSPECTED),
            new PatternRule(s -> s.cpuHigh() && !s.memoryHigh(), AnomalyPattern.CPU_SPIKE));

    @ConfigProperty(name = "analytics.composite.elevated-threshold", defaultValue = "1.0")
    double elevatedThreshold = DEFAULT_ELEVATED_THRESHOLD;

    @ConfigProperty(name = "analytics.composite.pattern-threshold", defaultValue = "2.0")
    double patternThreshold = DEFAULT_PATTERN_THRESHOLD;

    @ConfigProperty(name = "analytics.composite.min-score", defaultValue = "2.0")
    double minCompositeScore = DEFAULT_MIN_COMPOSITE_SCORE;

    Clock clock = Clock.systemUTC();

    /**
     * Root mean square of the given z-scores, rounded to two decimals.
     *
     * @return the composite score, 0 for an empty list
     */
    public double compositeScore(List<Double> zScores)
    {
        if (zScores == null || zScores.isEmpty()) {
            return 0.0;
        }
        double sumOfSquares = 0.0;
        for (double z : zScores) {
            sumOfSquares += z * z;
        }
        return StatisticsSupport.round(Math.sqrt(sumOfSquares / zScores.size()), 2);
    }

    /** Maps a composite score to its severity bucket. */
    public Severity classifySeverity(double compositeScore)
    {
        return Severity.fromScore(compositeScore);
    }

    /**
     * Matches the elevated metrics against {@link #PATTERN_RULES}.
     *
     * @return the first matching pattern, or {@code null}
     */
    public AnomalyPattern identifyPattern(List<MetricDeviationDTO> metrics)
    {
        PatternSignals signals = PatternSignals.of(metrics, patternThreshold);
        return PATTERN_RULES.stream()
                .filter(rule -> rule.condition().test(signals))
                .map(PatternRule::pattern)
                .findFirst()
                .orElse(null);
    }

    /**
     * Scores one entity with the configured minimum composite score.
     *
     * @see #score(String, String, List, double)
     */
    public CompositeAnomalyDTO score(String entityId, List<AnomalyVerdictDTO> verdicts)
    {
        return score(entityId, null, verdicts, minCompositeScore);
    }

    /**
     * Scores one entity.
     *
     * @param entityId          monitored entity
     * @param entityName        display name, the id is used when {@code null}
     * @param verdicts          one verdict per metric type with sufficient samples
     * @param minScore          results below this composite score are discarded
     * @return the composite anomaly, or {@code null} when no metric is elevated or the
     *         score is below {@code minScore}
     */
    public CompositeAnomalyDTO score(
            String entityId, String entityName, List<AnomalyVerdictDTO> verdicts, double minScore)
    {
        if (entityId == null || entityId.isBlank()) {
            throw ValidationException.missingParameter("entityId");
        }
        if (verdicts == null || verdicts.isEmpty()) {
            return null;
        }

        List<MetricDeviationDTO> elevated = verdicts.stream()
                .filter(Objects::nonNull)
                .filter(v -> Math.abs(v.zScore()) > elevatedThreshold)
                .map(MetricDeviationDTO::from)
                .toList();

        if (elevated.isEmpty()) {
            return null;
        }

        double score = compositeScore(elevated.stream().map(m -> Math.abs(m.zScore())).toList());
        if (score < minScore) {
            LOG.debugf("Composite score %.2f for %s below minimum %.2f", score, entityId, minScore);
            return null;
        }

        AnomalyPattern pattern = identifyPattern(elevated);
        Severity severity = classifySeverity(score);

        LOG.debugf("Composite anomaly for %s: score=%.2f severity=%s pattern=%s",
                entityId, score, severity.getLabel(), pattern != null ? pattern.getLabel() : "none");

        return new CompositeAnomalyDTO(
                entityId,
                entityName != null ? entityName : entityId,
                elevated,
                score,
                pattern != null ? pattern.getLabel() : null,
                pattern != null ? pattern.getDescription() : null,
                severity,
                Instant.now(clock));
    }

    /**
     * Scores every entity and orders the results by composite score, highest first.
     *
     * @param verdictsByEntity verdicts keyed by entity id
     * @param minScore         results below this composite score are discarded
     */
    public List<CompositeAnomalyDTO> scoreAll(Map<String, List<AnomalyVerdictDTO>> verdictsByEntity, double minScore)
    {
        if (verdictsByEntity == null || verdictsByEntity.isEmpty()) {
            return List.of();
        }

        List<CompositeAnomalyDTO> results = new ArrayList<>();
        verdictsByEntity.forEach((entityId, verdicts) -> {
            CompositeAnomalyDTO result = score(entityId, null, verdicts, minScore);
            if (result != null) {
                results.add(result);
            }
        });
        results.sort(Comparator.comparingDouble(CompositeAnomalyDTO::compositeScore).reversed());

        if (!results.isEmpty()) {
            LOG.infof("Composite scoring: %d of %d entities above score %.2f",
                    results.size(), verdictsByEntity.size(), minScore);
        }
        return results;
    }

    /** Scores every entity with the configured minimum composite score. */
    public List<CompositeAnomalyDTO> scoreAll(Map<String, List<AnomalyVerdictDTO>> verdictsByEntity)
    {
        return scoreAll(verdictsByEntity, minCompositeScore);
    }

    /**
     * Rule pairing a condition on the pattern signals with the pattern it identifies.
     */
    public record PatternRule(Predicate<PatternSignals> condition, AnomalyPattern pattern) {}

    /**
     * Whether the cpu family and the memory family (percentage or bytes) have a metric
     * with {@code z} above the pattern threshold.
     */
    public record PatternSignals(boolean cpuHigh, boolean memoryHigh)
    {
        static PatternSignals of(List<MetricDeviationDTO> metrics, double threshold)
        {
            boolean cpuHigh = metrics.stream()
                    .anyMatch(m -> MetricType.isFamily(m.type(), MetricType.Family.CPU) && m.zScore() > threshold);
            boolean memoryHigh = metrics.stream()
                    .anyMatch(m -> MetricType.isFamily(m.type(), MetricType.Family.MEMORY) && m.zScore() > threshold);
            return new PatternSignals(cpuHigh, memoryHigh);
        }
    }
}
