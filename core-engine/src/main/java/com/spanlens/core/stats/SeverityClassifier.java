package com.spanlens.core.stats;

import com.spanlens.core.model.Severity;
import com.spanlens.core.model.SpanEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Classifies closed spans by how long they stayed open relative to the rest
 * of the batch.
 *
 * <p>
 * Cut points come from {@link ThresholdCalculator} over every known,
 * non-negative duration in the batch, so the same absolute duration can be
 * {@code SEVERE} for an entity set that usually closes quickly and
 * {@code MODERATE} for one that does not.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeverityClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(SeverityClassifier.class);

    private final QuantileCutPoints cutPoints;

    private SeverityClassifier(QuantileCutPoints cutPoints) {
        this.cutPoints = cutPoints;
    }

    /**
     * Build a classifier calibrated on the durations of {@code events}.
     *
     * @param events    calibration batch; must not be {@code null}
     * @param quantiles three ascending quantiles
     * @return calibrated classifier
     */
    public static SeverityClassifier calibrate(Collection<SpanEvent> events, List<Double> quantiles) {
        Objects.requireNonNull(events, "events must not be null");
        List<Double> durations = events.stream()
                .filter(Objects::nonNull)
                .filter(e -> !e.isMalformed() && e.hasKnownDuration())
                .map(SpanEvent::getDurationMinutes)
                .toList();
        QuantileCutPoints cuts = ThresholdCalculator.cutPoints(durations, quantiles);
        LOG.debug("Severity cut points over {} duration(s): {}", durations.size(), cuts);
        return new SeverityClassifier(cuts);
    }

    /**
     * Calibrate at {@link ThresholdCalculator#STANDARD_QUANTILES}.
     */
    public static SeverityClassifier calibrate(Collection<SpanEvent> events) {
        return calibrate(events, ThresholdCalculator.STANDARD_QUANTILES);
    }

    /**
     * @param durationMinutes a non-negative duration
     * @return severity band of the duration
     */
    public Severity classify(double durationMinutes) {
        return switch (cutPoints.band(durationMinutes)) {
            case 0 -> Severity.LOW;
            case 1 -> Severity.MODERATE;
            case 2 -> Severity.HIGH;
            default -> Severity.SEVERE;
        };
    }

    /**
     * Classify every closed, well-formed event of a batch. Open and malformed
     * events are left out. Events that compare equal are classified once
     * each, not merged.
     *
     * @param events events to classify; must not be {@code null}
     * @return one classification per classified event, in input order
     */
    public List<Classification> classifyAll(Collection<SpanEvent> events) {
        Objects.requireNonNull(events, "events must not be null");
        List<Classification> result = new ArrayList<>();
        for (SpanEvent event : events) {
            if (event != null && !event.isMalformed() && event.hasKnownDuration()) {
                result.add(new Classification(event, classify(event.getDurationMinutes())));
            }
        }
        return result;
    }

    public QuantileCutPoints getCutPoints() {
        return cutPoints;
    }

    /**
     * A span together with its severity band.
     */
    public static final class Classification {

        private final SpanEvent event;
        private final Severity severity;

        Classification(SpanEvent event, Severity severity) {
            this.event = event;
            this.severity = severity;
        }

        public SpanEvent getEvent() {
            return event;
        }

        public Severity getSeverity() {
            return severity;
        }

        @Override
        public String toString() {
            return "Classification{" + event.getEntityId() + " " + event.getOpenTime() + " -> " + severity + '}';
        }
    }
}
