/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.oictarget.buffer.StreamBuffer;
import com.intuitivedesigns.oictarget.config.TargetSettings;
import com.intuitivedesigns.oictarget.core.BatchEnvelope;
import com.intuitivedesigns.oictarget.core.BatchSink;
import com.intuitivedesigns.oictarget.core.DeliveryOutcome;
import com.intuitivedesigns.oictarget.core.ErrorKind;
import com.intuitivedesigns.oictarget.core.StateSink;
import com.intuitivedesigns.oictarget.core.UndeliveredReport;
import com.intuitivedesigns.oictarget.error.DataValidationException;
import com.intuitivedesigns.oictarget.error.DeliveryException;
import com.intuitivedesigns.oictarget.error.ShutdownTimeoutException;
import com.intuitivedesigns.oictarget.error.UnknownStreamException;
import com.intuitivedesigns.oictarget.metrics.MetricsRuntime;
import com.intuitivedesigns.oictarget.singer.SingerMessage;
import com.intuitivedesigns.oictarget.singer.SingerMessageReader;
import com.intuitivedesigns.oictarget.transform.CompiledSchema;
import com.intuitivedesigns.oictarget.transform.RecordTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives the Singer message loop.
 *
 * <ul>
 *   <li>Messages are handled one at a time, in arrival order.</li>
 *   <li>Drained batches run on a bounded pool; each stream chains its batches on one lane, so a stream
 *       is delivered in drain order while different streams proceed in parallel.</li>
 *   <li>A STATE is held until every record accepted before it has been confirmed delivered.</li>
 *   <li>A periodic ticker flushes buffers that reached {@code maxBatchAge}, independent of input.</li>
 * </ul>
 *
 * The first failed batch stops the run: later batches are skipped, not sent, and the records still
 * unconfirmed are reported per stream.
 */
public final class PipelineOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final String METRIC_RECEIVED = "oic.records.received";
    static final String METRIC_INVALID = "oic.records.invalid";
    static final String METRIC_DELIVERED = "oic.records.delivered";
    static final String METRIC_BATCHES = "oic.batches.delivered";
    static final String METRIC_BATCHES_FAILED = "oic.batches.failed";
    static final String METRIC_STATES = "oic.state.emitted";
    static final String METRIC_BUFFERED = "oic.records.buffered";
    static final String METRIC_STATES_PENDING = "oic.state.pending";

    // Core Components
    private final TargetSettings settings;
    private final BatchSink sink;
    private final StateSink stateSink;
    private final MetricsRuntime metrics;
    private final Clock clock;
    private final RecordTransformer transformer = new RecordTransformer();
    private final SingerMessageReader reader = new SingerMessageReader();

    private final Map<String, StreamContext> contexts = new ConcurrentHashMap<>();

    // Runtime
    private final ExecutorService deliveryPool;
    private final ScheduledExecutorService ticker;
    private final ReentrantLock loopLock = new ReentrantLock();
    private final Instant startedAt;
    private volatile boolean started;
    private volatile boolean finished;
    private RunSummary summary;

    // Pending states, oldest first. Guarded by stateLock.
    private final ReentrantLock stateLock = new ReentrantLock();
    private final Queue<PendingState> pendingStates = new ArrayDeque<>();

    private final AtomicReference<RuntimeException> fatal = new AtomicReference<>();

    // Counters
    private final LongAdder received = new LongAdder();
    private final LongAdder invalid = new LongAdder();
    private final LongAdder deliveredRecords = new LongAdder();
    private final LongAdder deliveredBatches = new LongAdder();
    private final LongAdder statesEmitted = new LongAdder();

    private static final class PendingState {
        final JsonNode value;
        final Map<String, Long> watermarks;

        PendingState(JsonNode value, Map<String, Long> watermarks) {
            this.value = value;
            this.watermarks = watermarks;
        }
    }

    public PipelineOrchestrator(TargetSettings settings,
                                BatchSink sink,
                                StateSink stateSink,
                                MetricsRuntime metrics,
                                Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.stateSink = Objects.requireNonNull(stateSink, "stateSink");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startedAt = clock.instant();

        this.deliveryPool = Executors.newFixedThreadPool(settings.concurrentStreams, daemonFactory("oic-delivery"));
        this.ticker = Executors.newSingleThreadScheduledExecutor(daemonFactory("oic-flush-ticker"));
    }

    /**
     * Starts the periodic flush ticker.
     */
    public void start() {
        if (started) return;
        started = true;
        long periodMs = settings.flushInterval.toMillis();
        ticker.scheduleWithFixedDelay(this::tickSafely, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Pipeline started: sink={} batchSize={} maxBatchAge={}ms concurrentStreams={}",
                sink.id(), settings.batchSize, settings.maxBatchAge.toMillis(), settings.concurrentStreams);
    }

    /**
     * Consumes every line of {@code in}, then drains and delivers what remains.
     * On a fatal error the undelivered records are reported before the error is rethrown.
     */
    public RunSummary run(BufferedReader in) throws IOException {
        start();
        try {
            String line;
            long lineNumber = 0;
            while ((line = in.readLine()) != null) {
                lineNumber++;
                reader.parse(line, lineNumber).ifPresent(this::handle);
            }
        } catch (DeliveryException e) {
            throw e.withUndelivered(abort());
        } catch (RuntimeException | IOException e) {
            abort();
            throw e;
        }
        return finish();
    }

    public void handle(SingerMessage message) {
        Objects.requireNonNull(message, "message");
        loopLock.lock();
        try {
            if (finished) throw new IllegalStateException("Pipeline is shut down");
            throwIfFatal();

            if (message instanceof SingerMessage.RecordMessage r) {
                onRecord(r);
            } else if (message instanceof SingerMessage.SchemaMessage s) {
                onSchema(s);
            } else if (message instanceof SingerMessage.StateMessage st) {
                onState(st);
            } else {
                throw new IllegalArgumentException("Unsupported message: " + message.getClass().getName());
            }
        } finally {
            loopLock.unlock();
        }
    }

    // --- Message handlers ---

    private void onSchema(SingerMessage.SchemaMessage msg) {
        final CompiledSchema compiled = CompiledSchema.compile(msg.schema());
        final StreamContext existing = contexts.get(msg.stream());

        if (existing == null) {
            StreamBuffer buffer = new StreamBuffer(msg.stream(), settings.batchSize, settings.maxBatchAge, clock);
            contexts.put(msg.stream(), new StreamContext(msg.stream(), compiled, buffer));
            log.info("Stream '{}' registered ({} properties, {} required, keys={})",
                    msg.stream(), compiled.rules().size(), compiled.required().size(), msg.keyProperties());
            return;
        }

        if (existing.schema.sameSource(msg.schema())) return;

        existing.lock.lock();
        try {
            // Records buffered under the old schema go out before the new one applies
            int flushed = drainAndEnqueue(existing);
            existing.schema = compiled;
            log.info("Schema changed for stream '{}' (flushed {} buffered records first)", msg.stream(), flushed);
        } finally {
            existing.lock.unlock();
        }
    }

    private void onRecord(SingerMessage.RecordMessage msg) {
        final StreamContext ctx = contexts.get(msg.stream());
        if (ctx == null) throw new UnknownStreamException(msg.stream());

        received.increment();
        metrics.counter(METRIC_RECEIVED);

        final ObjectNode transformed;
        try {
            transformed = transformer.transform(msg.record(), ctx.schema);
        } catch (DataValidationException e) {
            invalid.increment();
            metrics.counter(METRIC_INVALID);
            log.warn("Skipping invalid record for stream '{}': {}", msg.stream(), e.getMessage());
            checkValidationThreshold(e.field(), false);
            return;
        }

        ctx.lock.lock();
        try {
            ctx.buffer.add(transformed);
            ctx.accepted.incrementAndGet();
            ctx.state = StreamState.ACTIVE;
            if (ctx.buffer.size() >= settings.batchSize) {
                drainAndEnqueue(ctx);
            }
        } finally {
            ctx.lock.unlock();
        }
    }

    private void onState(SingerMessage.StateMessage msg) {
        final Map<String, Long> watermarks = new HashMap<>();
        for (StreamContext ctx : contexts.values()) {
            long accepted = ctx.accepted.get();
            if (ctx.delivered.get() < accepted) watermarks.put(ctx.stream, accepted);
        }

        stateLock.lock();
        try {
            pendingStates.add(new PendingState(msg.value(), Collections.unmodifiableMap(watermarks)));
            if (!watermarks.isEmpty()) {
                log.debug("State held until delivery of {}", watermarks);
            }
        } finally {
            stateLock.unlock();
        }
        emitReadyStates();
    }

    // --- Flush & delivery ---

    /**
     * Drains every buffer whose size or age trigger has fired.
     */
    void tick() {
        if (fatal.get() != null) return;
        long buffered = 0;
        for (StreamContext ctx : contexts.values()) {
            ctx.lock.lock();
            try {
                ctx.buffer.drainIfDue().ifPresent(batch -> enqueue(ctx, batch));
                buffered += ctx.buffer.size();
            } finally {
                ctx.lock.unlock();
            }
        }
        metrics.gauge(METRIC_BUFFERED, buffered);
        stateLock.lock();
        try {
            metrics.gauge(METRIC_STATES_PENDING, pendingStates.size());
        } finally {
            stateLock.unlock();
        }
    }

    private void tickSafely() {
        try {
            tick();
        } catch (RuntimeException e) {
            // An exception would cancel the scheduled task
            log.error("Flush tick failed", e);
        }
    }

    // Caller holds ctx.lock
    private int drainAndEnqueue(StreamContext ctx) {
        return ctx.buffer.drain().map(batch -> {
            enqueue(ctx, batch);
            return batch.size();
        }).orElse(0);
    }

    // Caller holds ctx.lock
    private void enqueue(StreamContext ctx, BatchEnvelope batch) {
        log.debug("Flushing batch {} for stream '{}' ({} records, seq={})", batch.batchId(), batch.stream(), batch.size(), batch.sequence());
        ctx.lane = ctx.lane.thenRunAsync(() -> deliver(ctx, batch), deliveryPool);
    }

    private void deliver(StreamContext ctx, BatchEnvelope batch) {
        if (fatal.get() != null) {
            log.debug("Skipping batch {} for stream '{}' after an earlier delivery failure", batch.batchId(), ctx.stream);
            return;
        }

        DeliveryOutcome outcome;
        try {
            outcome = sink.deliver(batch);
        } catch (RuntimeException e) {
            log.error("Sink threw while delivering batch {}", batch.batchId(), e);
            outcome = DeliveryOutcome.failure(ErrorKind.NETWORK, 0, e.toString()).exhausted();
        }

        if (!outcome.success()) {
            metrics.counter(METRIC_BATCHES_FAILED);
            DeliveryException failure = new DeliveryException(ctx.stream, batch.batchId(), outcome, UndeliveredReport.empty());
            if (fatal.compareAndSet(null, failure)) {
                log.error("Batch {} for stream '{}' ({} records) failed: {}",
                        batch.batchId(), ctx.stream, batch.size(), outcome.describe());
            }
            return;
        }

        if (outcome.processed() != batch.size()) {
            log.warn("OIC reported {} processed for batch {} of {} records", outcome.processed(), batch.batchId(), batch.size());
        }
        ctx.delivered.addAndGet(batch.size());
        deliveredRecords.add(batch.size());
        deliveredBatches.increment();
        metrics.counter(METRIC_DELIVERED, batch.size());
        metrics.counter(METRIC_BATCHES);

        try {
            emitReadyStates();
        } catch (RuntimeException e) {
            log.error("State emission failed", e);
            fatal.compareAndSet(null, e);
        }
    }

    private void emitReadyStates() {
        stateLock.lock();
        try {
            PendingState head;
            while ((head = pendingStates.peek()) != null && isSettled(head)) {
                pendingStates.poll();
                stateSink.emit(head.value);
                statesEmitted.increment();
                metrics.counter(METRIC_STATES);
            }
        } finally {
            stateLock.unlock();
        }
    }

    private boolean isSettled(PendingState state) {
        for (Map.Entry<String, Long> e : state.watermarks.entrySet()) {
            StreamContext ctx = contexts.get(e.getKey());
            if (ctx == null || ctx.delivered.get() < e.getValue()) return false;
        }
        return true;
    }

    // --- Validation ---

    private void checkValidationThreshold(String field, boolean finalCheck) {
        long bad = invalid.sum();
        long total = received.sum();
        if (bad == 0 || total == 0) return;
        if (!finalCheck && total < settings.validationMinRecords) return;

        double ratio = (double) bad / total;
        if (ratio > settings.validationErrorThreshold) {
            throw new DataValidationException(field, String.format(
                    "%d of %d records failed validation (%.4f > threshold %.4f)",
                    bad, total, ratio, settings.validationErrorThreshold));
        }
    }

    // --- Shutdown ---

    /**
     * Graceful shutdown: drains all buffers, waits up to the grace period for delivery,
     * emits the remaining states and closes the sink. Safe to call more than once.
     *
     * @throws DeliveryException if a batch failed; carries the per-stream undelivered counts
     * @throws ShutdownTimeoutException if deliveries did not finish within the grace period
     */
    public RunSummary finish() {
        loopLock.lock();
        try {
            if (finished) {
                if (summary == null) throw new IllegalStateException("Pipeline was aborted");
                return summary;
            }
            finished = true;
            ticker.shutdownNow();

            try {
                throwIfFatal();
                checkValidationThreshold(null, true);
            } catch (DeliveryException e) {
                throw e.withUndelivered(shutdownAndReport(settings.shutdownGrace));
            } catch (RuntimeException e) {
                shutdownAndReport(settings.shutdownGrace);
                throw e;
            }

            log.info("Draining {} streams...", contexts.size());
            CompletableFuture<?>[] lanes = contexts.values().stream().map(ctx -> {
                ctx.lock.lock();
                try {
                    ctx.state = StreamState.DRAINING;
                    drainAndEnqueue(ctx);
                    return ctx.lane;
                } finally {
                    ctx.lock.unlock();
                }
            }).toArray(CompletableFuture[]::new);

            awaitLanes(lanes);

            RuntimeException failure = fatal.get();
            if (failure instanceof DeliveryException de) {
                throw de.withUndelivered(shutdownAndReport(settings.shutdownGrace));
            } else if (failure != null) {
                shutdownAndReport(settings.shutdownGrace);
                throw failure;
            }

            emitReadyStates();
            stateLock.lock();
            try {
                if (!pendingStates.isEmpty()) {
                    log.warn("{} states were never settled and are not emitted", pendingStates.size());
                }
            } finally {
                stateLock.unlock();
            }

            contexts.values().forEach(ctx -> ctx.state = StreamState.CLOSED);
            stopPool(settings.shutdownGrace);
            safeClose(sink, "sink");

            summary = new RunSummary(
                    contexts.size(),
                    received.sum(),
                    invalid.sum(),
                    deliveredRecords.sum(),
                    deliveredBatches.sum(),
                    statesEmitted.sum(),
                    Duration.between(startedAt, clock.instant()));
            log.info("Run complete: {}", summary);
            return summary;
        } finally {
            loopLock.unlock();
        }
    }

    private void awaitLanes(CompletableFuture<?>[] lanes) {
        try {
            CompletableFuture.allOf(lanes).get(settings.shutdownGrace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // The grace period is spent: abandon in-flight work instead of waiting again
            UndeliveredReport report = shutdownAndReport(Duration.ZERO);
            throw new ShutdownTimeoutException(settings.shutdownGrace, report);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            UndeliveredReport report = shutdownAndReport(Duration.ZERO);
            throw new ShutdownTimeoutException(settings.shutdownGrace, report);
        } catch (ExecutionException e) {
            // deliver() handles its own failures; this is a rejected or cancelled lane
            log.error("Delivery lane failed", e.getCause());
            if (fatal.get() == null) {
                shutdownAndReport(settings.shutdownGrace);
                throw new IllegalStateException("Delivery lane failed", e.getCause());
            }
        }
    }

    /**
     * Stops the run without draining. In-flight deliveries get the grace period to finish.
     *
     * @return per-stream count of records never confirmed delivered
     */
    public UndeliveredReport abort() {
        loopLock.lock();
        try {
            finished = true;
            ticker.shutdownNow();
            return shutdownAndReport(settings.shutdownGrace);
        } finally {
            loopLock.unlock();
        }
    }

    private UndeliveredReport shutdownAndReport(Duration wait) {
        stopPool(wait);
        safeClose(sink, "sink");

        Map<String, Long> counts = new HashMap<>();
        contexts.values().forEach(ctx -> {
            counts.put(ctx.stream, ctx.undelivered());
            ctx.state = StreamState.CLOSED;
        });
        UndeliveredReport report = UndeliveredReport.of(counts);

        report.byStream().forEach((stream, n) ->
                log.error("UNDELIVERED: stream '{}' has {} records not confirmed delivered", stream, n));
        return report;
    }

    private void stopPool(Duration wait) {
        if (wait.isZero()) {
            deliveryPool.shutdownNow();
            return;
        }
        deliveryPool.shutdown();
        try {
            if (!deliveryPool.awaitTermination(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Delivery workers still busy after {}; abandoning", wait);
                deliveryPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            deliveryPool.shutdownNow();
        }
    }

    @Override
    public void close() {
        if (!finished) abort();
    }

    // --- Introspection for tests and the CLI ---

    public StreamState streamState(String stream) {
        StreamContext ctx = contexts.get(stream);
        return ctx == null ? null : ctx.state;
    }

    public int buffered(String stream) {
        StreamContext ctx = contexts.get(stream);
        return ctx == null ? 0 : ctx.buffer.size();
    }

    /**
     * Waits for every batch drained so far to settle.
     */
    void awaitIdle(Duration timeout) throws Exception {
        CompletableFuture<?>[] lanes = contexts.values().stream().map(StreamContext::lane).toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(lanes).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    // --- Helpers ---

    private void throwIfFatal() {
        RuntimeException failure = fatal.get();
        if (failure != null) throw failure;
    }

    private static void safeClose(AutoCloseable c, String name) {
        try {
            c.close();
        } catch (Exception e) {
            log.warn("Error closing {}", name, e);
        }
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
