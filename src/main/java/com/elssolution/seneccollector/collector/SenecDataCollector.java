package com.elssolution.seneccollector.collector;

import com.elssolution.seneccollector.alerts.AlertService;
import com.elssolution.seneccollector.domain.RawStatus;
import com.elssolution.seneccollector.integration.senec.AdapterContractException;
import com.elssolution.seneccollector.integration.senec.FetchException;
import com.elssolution.seneccollector.integration.senec.StatusFetcher;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Polls one SENEC device on its own thread and buffers every reading in a FIFO
 * for consumers on other threads.
 *
 * Loop: fetch (blocking) → enqueue → wait interval on the stop signal → repeat.
 * A failed cycle is logged, raised as an alert and leaves a gap in the queue;
 * it never ends the loop. {@link #stop()} is cooperative: an in-flight fetch
 * finishes and its reading is still enqueued.
 *
 * One instance runs once. After stop a new collector has to be built.
 */
@Slf4j
public class SenecDataCollector {

    public enum State { IDLE, RUNNING, STOPPING, STOPPED }

    static final String ALERT_DOWN = "SENEC_DOWN";
    static final String ALERT_CONTRACT = "SENEC_CONTRACT";
    static final String ALERT_INTERVAL = "SENEC_INTERVAL";

    private final CollectorConfig config;
    private final StatusFetcher fetcher;
    private final AlertService alerts;
    private final ThreadFactory threadFactory;

    private final BlockingQueue<RawStatus> queue = new LinkedBlockingQueue<>();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private volatile Thread worker;

    // ==== counters for status/health ====
    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private volatile long lastSuccessMs = 0L;
    private volatile long lastFailureMs = 0L;
    private volatile String lastError = null;

    public SenecDataCollector(CollectorConfig config,
                              StatusFetcher fetcher,
                              AlertService alerts,
                              ThreadFactory threadFactory) {
        this.config = config;
        this.fetcher = fetcher;
        this.alerts = alerts;
        this.threadFactory = threadFactory;

        if (config.isBelowRecommendedInterval()) {
            String msg = "Poll interval " + config.getInterval().toSeconds() + " s is below the recommended "
                    + CollectorConfig.RECOMMENDED_MIN_INTERVAL.toSeconds()
                    + " s, this may disturb the device's connection to the cloud";
            log.warn("collector_interval_short host={} interval={}ms: {}", config.getHost(), config.getInterval().toMillis(), msg);
            alerts.raise(ALERT_INTERVAL, msg, AlertService.Severity.WARN);
        }
    }

    // ---- Lifecycle ----

    /**
     * Starts the polling thread.
     *
     * @throws IllegalStateException if the collector was started or stopped before
     */
    public void start() {
        if (!state.compareAndSet(State.IDLE, State.RUNNING)) {
            State s = state.get();
            throw new IllegalStateException(s == State.RUNNING
                    ? "Collector for " + config.getHost() + " is already running"
                    : "Collector for " + config.getHost() + " was stopped (" + s + "), build a new one");
        }
        try {
            Thread t = threadFactory.newThread(this::runLoop);
            if (t == null) {
                throw new IllegalStateException("Thread factory refused a thread for " + config.getHost());
            }
            worker = t;
            t.start();
        } catch (RuntimeException | Error e) {
            state.set(State.STOPPED);
            stopSignal.countDown();
            log.error("collector_start_failed host={} error={}", config.getHost(), e.toString());
            throw e;
        }
    }

    /** Requests the loop to end. Does not interrupt a running fetch. Safe to call repeatedly. */
    public void stop() {
        if (state.compareAndSet(State.IDLE, State.STOPPED)) {
            log.debug("collector_stop before start host={}", config.getHost());
        } else if (state.compareAndSet(State.RUNNING, State.STOPPING)) {
            log.info("collector_stop_requested host={}", config.getHost());
        }
        stopSignal.countDown();
    }

    /**
     * Waits for the polling thread to exit.
     *
     * @return true if the thread is gone (or never started)
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        Thread t = worker;
        if (t == null) return state.get() != State.RUNNING;
        t.join(Math.max(1L, timeout.toMillis()));
        return !t.isAlive();
    }

    /** stop() + bounded join; used as the bean destroy hook. */
    public void shutdown() {
        stop();
        try {
            // an in-flight fetch is bounded by the HTTP request timeout
            if (!awaitTermination(Duration.ofSeconds(15))) {
                log.warn("collector_shutdown_timeout host={} thread still busy", config.getHost());
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    public State getState() {
        return state.get();
    }

    public boolean isStopRequested() {
        return stopSignal.getCount() == 0;
    }

    public CollectorConfig getConfig() {
        return config;
    }

    // ---- Poll loop ----
    private void runLoop() {
        try {
            long intervalMs = config.getInterval().toMillis();
            log.info("collector_started host={} interval={}ms singleShot={}", config.getHost(), intervalMs, config.isSingleShot());
            while (!isStopRequested()) {
                collectOnce();

                if (config.isSingleShot()) {
                    log.info("collector_single_shot_done host={}", config.getHost());
                    stop();
                    break;
                }
                if (stopSignal.await(intervalMs, TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("collector_interrupted host={}", config.getHost());
        } finally {
            state.set(State.STOPPED);
            log.info("collector_stopped host={} cycles={} failures={} queued={}",
                    config.getHost(), cycles.get(), failures.get(), queue.size());
        }
    }

    /**
     * One fetch-and-enqueue cycle. Contains every failure of the fetcher, including
     * {@link Error}s such as a {@link LinkageError}; only a {@link VirtualMachineError}
     * (out of memory, stack overflow) is rethrown and ends the loop.
     */
    void collectOnce() {
        cycles.incrementAndGet();
        try {
            RawStatus status = fetcher.fetch(config.getHost());
            if (status == null) {
                throw new AdapterContractException(0);
            }
            queue.add(status);
            lastSuccessMs = System.currentTimeMillis();
            lastError = null;
            alerts.resolve(ALERT_DOWN);
            alerts.resolve(ALERT_CONTRACT);
            if (log.isDebugEnabled()) {
                log.debug("data_collected host={} queued={}", config.getHost(), queue.size());
            }
        } catch (AdapterContractException e) {
            onCycleFailed(ALERT_CONTRACT, e);
        } catch (FetchException e) {
            onCycleFailed(ALERT_DOWN, e);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            onCycleFailed(ALERT_DOWN, e);
        }
    }

    private void onCycleFailed(String alertKey, Throwable e) {
        failures.incrementAndGet();
        lastFailureMs = System.currentTimeMillis();
        lastError = e.getMessage();
        log.warn("fetch_failed host={} cycle={} error={}", config.getHost(), cycles.get(), e.toString());
        if (!isStopRequested()) {
            alerts.raise(alertKey, "Fetch from " + config.getHost() + " failed: " + e.getMessage(),
                    AlertService.Severity.ERROR);
        }
    }

    // ---- Consumer API ----

    /** Number of buffered readings; does not dequeue. */
    public int availableData() {
        return queue.size();
    }

    /**
     * Takes the oldest reading.
     *
     * @param block wait until a reading arrives; when false an empty queue yields empty at once
     */
    public Optional<RawStatus> getData(boolean block) {
        if (!block) {
            return Optional.ofNullable(queue.poll());
        }
        try {
            return Optional.of(queue.take());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    /** Takes the oldest reading, waiting at most {@code timeout}. */
    public Optional<RawStatus> getData(Duration timeout) {
        try {
            return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    /** Drains everything buffered right now, oldest first. Never blocks. */
    public List<RawStatus> getAllData() {
        List<RawStatus> out = new ArrayList<>(queue.size());
        queue.drainTo(out);
        return out;
    }

    // ---- Status ----

    @Value @Builder
    public static class Stats {
        String host;
        long intervalMs;
        State state;
        int queued;
        long cycles;
        long failures;
        long lastSuccessMs;   // 0 = never
        long lastFailureMs;   // 0 = never
        String lastError;
    }

    public Stats stats() {
        return Stats.builder()
                .host(config.getHost())
                .intervalMs(config.getInterval().toMillis())
                .state(state.get())
                .queued(queue.size())
                .cycles(cycles.get())
                .failures(failures.get())
                .lastSuccessMs(lastSuccessMs)
                .lastFailureMs(lastFailureMs)
                .lastError(lastError)
                .build();
    }
}
