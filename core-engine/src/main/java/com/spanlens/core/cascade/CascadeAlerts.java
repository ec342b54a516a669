package com.spanlens.core.cascade;

import com.spanlens.core.config.CascadeSettings;
import com.spanlens.core.model.CascadeRecord;
import com.spanlens.core.model.SpanEvent;
import com.spanlens.core.stats.QuantileCutPoints;
import com.spanlens.core.stats.ThresholdCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Projects upcoming target openings from recent trigger openings and the
 * historical cascades of those triggers.
 *
 * <p>
 * Only historical cascades at or above the median strength of the supplied
 * set are used, so weak relationships never raise an alert.
 * </p>
 *
 * @since 1.0.0
 */
public class CascadeAlerts {

    private static final Logger LOG = LoggerFactory.getLogger(CascadeAlerts.class);

    private final Duration recentWindow;
    private final Duration lookahead;
    private final List<Double> cutPointQuantiles;

    public CascadeAlerts() {
        this(new CascadeSettings());
    }

    /**
     * @param settings cascade settings; the window maximum bounds how recent a
     *                 trigger must be and the alert lookahead bounds how far
     *                 ahead alerts are projected
     */
    public CascadeAlerts(CascadeSettings settings) {
        Objects.requireNonNull(settings, "CascadeSettings must not be null");
        this.recentWindow = minutes(settings.getWindowMaxMinutes());
        this.lookahead = minutes(settings.getAlertLookaheadMinutes());
        this.cutPointQuantiles = List.copyOf(settings.getCutPointQuantiles());
    }

    /**
     * Alerts expected within the configured lookahead.
     */
    public List<CascadeAlert> upcoming(Collection<SpanEvent> recentEvents, Collection<CascadeRecord> cascades,
            Instant now) {
        return upcoming(recentEvents, cascades, now, lookahead);
    }

    /**
     * @param recentEvents events to project from; only those opened within the
     *                     cascade window before {@code now} are used
     * @param cascades     historical cascades
     * @param now          reference instant
     * @param lookahead    how far ahead of {@code now} alerts are kept
     * @return alerts with an expected time in {@code (now, now + lookahead]},
     *         sorted by expected time
     */
    public List<CascadeAlert> upcoming(Collection<SpanEvent> recentEvents, Collection<CascadeRecord> cascades,
            Instant now, Duration lookahead) {
        Objects.requireNonNull(recentEvents, "recentEvents must not be null");
        Objects.requireNonNull(cascades, "cascades must not be null");
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(lookahead, "lookahead must not be null");
        if (cascades.isEmpty() || recentEvents.isEmpty()) {
            return Collections.emptyList();
        }

        List<Double> strengths = new ArrayList<>(cascades.size());
        cascades.forEach(c -> strengths.add(c.getStrength()));
        QuantileCutPoints cuts = ThresholdCalculator.cutPoints(strengths, cutPointQuantiles);

        Instant earliest = now.minus(recentWindow);
        Instant horizon = now.plus(lookahead);
        List<CascadeAlert> alerts = new ArrayList<>();
        for (SpanEvent event : recentEvents) {
            if (event == null || event.isMalformed()
                    || event.getOpenTime().isBefore(earliest) || event.getOpenTime().isAfter(now)) {
                continue;
            }
            for (CascadeRecord pattern : cascades) {
                if (!pattern.getTriggerEntityId().equals(event.getEntityId())
                        || pattern.getStrength() < cuts.getMedian()) {
                    continue;
                }
                Instant expected = event.getOpenTime().plus(minutes(pattern.getDelayMinutes()));
                if (expected.isAfter(now) && !expected.isAfter(horizon)) {
                    alerts.add(new CascadeAlert(event, pattern, expected));
                }
            }
        }
        alerts.sort(Comparator.comparing(CascadeAlert::getExpectedTime)
                .thenComparing(CascadeAlert::getTargetEntityId));
        LOG.debug("Projected {} cascade alert(s) from {} recent event(s)", alerts.size(), recentEvents.size());
        return alerts;
    }

    private static Duration minutes(double minutes) {
        return Duration.ofMillis(Math.round(minutes * 60_000.0));
    }
}
