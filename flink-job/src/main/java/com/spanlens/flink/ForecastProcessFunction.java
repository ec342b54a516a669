package com.spanlens.flink;

import com.spanlens.core.analytics.AnalyticsAggregator;
import com.spanlens.core.config.EngineConfig;
import com.spanlens.core.model.AnalyticsRecord;
import com.spanlens.core.model.ComputeTier;
import com.spanlens.core.model.Forecast;
import com.spanlens.core.model.SpanEvent;
import com.spanlens.core.prediction.ForecastRequest;
import com.spanlens.core.prediction.PredictionEngine;
import org.apache.flink.api.common.state.ListState;
import org.apache.flink.api.common.state.ListStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-entity forecasting operator. Keyed by entity id.
 *
 * <h3>Processing Flow</h3>
 * <ol>
 * <li>Append the incoming span to the entity's history (Flink list state),
 * keeping only the most recent {@code historySize} spans by open time</li>
 * <li>Aggregate the history into analytics buckets</li>
 * <li>Forecast the entity's next opening as of the incoming span's open
 * time and emit it when the history is long enough</li>
 * </ol>
 *
 * <p>
 * Exceptions from the engines are logged and swallowed per event so a
 * single pathological history cannot take down the job. Cascade boosting
 * is not applied here; cascades are detected by the windowed branch.
 * </p>
 *
 * @since 1.0.0
 */
public class ForecastProcessFunction extends KeyedProcessFunction<String, SpanEvent, Forecast> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ForecastProcessFunction.class);

    private final EngineConfig engineConfig;
    private final ComputeTier computeTier;
    private final int historySize;

    private transient ListState<SpanEvent> historyState;
    private transient AnalyticsAggregator aggregator;
    private transient PredictionEngine predictionEngine;
    private transient SpanLensMetrics metrics;

    public ForecastProcessFunction(EngineConfig engineConfig, ComputeTier computeTier, int historySize) {
        this.engineConfig = Objects.requireNonNull(engineConfig, "engineConfig must not be null");
        this.computeTier = Objects.requireNonNull(computeTier, "computeTier must not be null");
        if (historySize < 3) {
            throw new IllegalArgumentException("historySize must be >= 3, got: " + historySize);
        }
        this.historySize = historySize;
    }

    @Override
    public void open(Configuration parameters) throws Exception {
        super.open(parameters);

        historyState = getRuntimeContext().getListState(
                new ListStateDescriptor<>("span-history", TypeInformation.of(SpanEvent.class)));

        aggregator = new AnalyticsAggregator(engineConfig);
        predictionEngine = new PredictionEngine(engineConfig);
        metrics = new SpanLensMetrics(getRuntimeContext().getMetricGroup());

        LOG.info("ForecastProcessFunction opened: tier={}, historySize={}", computeTier, historySize);
    }

    @Override
    public void processElement(SpanEvent event, Context ctx, Collector<Forecast> out) throws Exception {
        long start = System.nanoTime();
        metrics.incrementEventsProcessed();

        List<SpanEvent> history = appendToHistory(event);

        try {
            List<AnalyticsRecord> analytics = aggregator.aggregate(history);
            ForecastRequest request = ForecastRequest.builder()
                    .entityId(event.getEntityId())
                    .events(history)
                    .analytics(analytics)
                    .tier(computeTier)
                    .now(event.getOpenTime())
                    .build();

            Optional<Forecast> forecast = predictionEngine.forecast(request);
            if (forecast.isPresent()) {
                out.collect(forecast.get());
                metrics.incrementForecastsEmitted();
                LOG.debug("Forecast emitted for entity {}: {}", event.getEntityId(), forecast.get());
            }
        } catch (Exception e) {
            LOG.error("Forecasting failed for entity {} (history {}): {}",
                    event.getEntityId(), history.size(), e.getMessage(), e);
        }

        metrics.recordLatency((System.nanoTime() - start) / 1_000_000);
    }

    private List<SpanEvent> appendToHistory(SpanEvent event) throws Exception {
        List<SpanEvent> history = new ArrayList<>();
        Iterable<SpanEvent> stored = historyState.get();
        if (stored != null) {
            stored.forEach(history::add);
        }
        history.add(event);
        history.sort(Comparator.comparing(SpanEvent::getOpenTime));

        if (history.size() > historySize) {
            history = new ArrayList<>(history.subList(history.size() - historySize, history.size()));
        }
        historyState.update(history);
        return history;
    }
}
