package com.acme.asuc.governor.telemetry;

import com.acme.asuc.governor.GovernorStats;
import com.acme.asuc.governor.util.JsonCodec;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Logs governor stats as a JSON line on a fixed interval.
 */
public final class PeriodicStatsReporter implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PeriodicStatsReporter.class.getName());

    private final Supplier<GovernorStats> statsSupplier;
    private final ScheduledExecutorService executor;
    private final long intervalSeconds;

    public PeriodicStatsReporter(Supplier<GovernorStats> statsSupplier, long intervalSeconds) {
        this.statsSupplier = Objects.requireNonNull(statsSupplier, "statsSupplier");
        this.intervalSeconds = Math.max(1L, intervalSeconds);
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "governor-stats-reporter");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        executor.scheduleAtFixedRate(this::emit, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    String render() {
        Map<String, Object> payload = statsSupplier.get().toPayload();
        payload.put("component", "governor");
        payload.put("type", "governor_stats");
        try {
            return JsonCodec.writeString(payload);
        } catch (Exception e) {
            return payload.toString();
        }
    }

    void emit() {
        try {
            LOG.info(render());
        } catch (Throwable t) {
            LOG.warning("Stats reporter failure: " + t.getClass().getSimpleName());
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
