package com.spanlens.flink;

import com.spanlens.core.cascade.CascadeEngine;
import com.spanlens.core.config.EngineConfig;
import com.spanlens.core.model.CascadeRecord;
import com.spanlens.core.model.EntityLocation;
import com.spanlens.core.model.SpanEvent;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.windowing.ProcessAllWindowFunction;
import org.apache.flink.streaming.api.windowing.windows.TimeWindow;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs cascade detection over every span that opened inside one event-time
 * window. Entity locations are taken from the spans themselves.
 *
 * <p>
 * Cascades whose trigger and target fall on either side of a window
 * boundary are not detected.
 * </p>
 *
 * @since 1.0.0
 */
public class CascadeWindowFunction extends ProcessAllWindowFunction<SpanEvent, CascadeRecord, TimeWindow> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(CascadeWindowFunction.class);

    private final EngineConfig engineConfig;

    private transient CascadeEngine cascadeEngine;
    private transient SpanLensMetrics metrics;

    public CascadeWindowFunction(EngineConfig engineConfig) {
        this.engineConfig = Objects.requireNonNull(engineConfig, "engineConfig must not be null");
    }

    @Override
    public void open(Configuration parameters) throws Exception {
        super.open(parameters);
        cascadeEngine = new CascadeEngine(engineConfig);
        metrics = new SpanLensMetrics(getRuntimeContext().getMetricGroup());
    }

    @Override
    public void process(Context context, Iterable<SpanEvent> elements, Collector<CascadeRecord> out) {
        long start = System.nanoTime();
        List<SpanEvent> events = new ArrayList<>();
        elements.forEach(events::add);
        metrics.incrementEventsProcessed(events.size());

        try {
            List<CascadeRecord> cascades = cascadeEngine.detectCascades(events, EntityLocation.fromEvents(events));
            cascades.forEach(out::collect);
            metrics.incrementCascadesDetected(cascades.size());
            LOG.debug("Window [{} - {}]: {} spans, {} cascades",
                    context.window().getStart(), context.window().getEnd(), events.size(), cascades.size());
        } catch (Exception e) {
            LOG.error("Cascade detection failed for window [{} - {}] with {} spans: {}",
                    context.window().getStart(), context.window().getEnd(), events.size(), e.getMessage(), e);
        }

        metrics.recordLatency((System.nanoTime() - start) / 1_000_000);
    }
}
