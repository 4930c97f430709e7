package io.borgqueue.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.borgqueue.JobContext;
import io.borgqueue.JobHandler;
import io.borgqueue.JobQueue;
import io.borgqueue.core.Job;
import io.borgqueue.core.JobCancelledException;
import io.borgqueue.core.JobHandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drains one lane, one job at a time.
 *
 * <p>Loop: claim the next pending job, look up its handler, run it, then complete or fail the
 * job. Anything a handler throws fails its job and never escapes the loop, except a
 * {@link VirtualMachineError}, which fails the job and then terminates the worker thread.
 * Throughput across jobs of a lane comes from running more worker processes, not more threads
 * in one.
 *
 * <p>{@link #stop()} stops claiming, lets the in-flight job finish within the shutdown grace
 * period, then interrupts the worker thread.
 */
public class Worker {
    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final JobQueue queue;
    private final JobHandlerRegistry registry;
    private final ObjectMapper objectMapper;
    private final WorkerSettings settings;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicReference<Job> inFlight = new AtomicReference<>();
    private volatile CountDownLatch stopSignal = new CountDownLatch(0);
    private Thread workerThread;
    private int systemErrorCount = 0;

    public Worker(JobQueue queue, JobHandlerRegistry registry, ObjectMapper objectMapper, WorkerSettings settings) {
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Start draining the lane. Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("Worker starting lane={} workerId={} pollInterval={} handlers={}",
                settings.lane(), settings.workerId(), settings.pollInterval(), registry.types());
        if (registry.isEmpty()) {
            log.warn("Worker lane={} has no registered handlers; every claimed job will fail", settings.lane());
        }

        stopSignal = new CountDownLatch(1);
        workerThread = new Thread(this::pollLoop);
        workerThread.setName("borgqueue.worker-" + settings.lane());
        workerThread.setDaemon(false);
        workerThread.start();
    }

    /**
     * Stop claiming and wait for the in-flight job. Idempotent.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Worker stopping lane={}...", settings.lane());
        stopSignal.countDown();

        Thread t = workerThread;
        workerThread = null;
        if (t == null || t == Thread.currentThread()) {
            return;
        }
        try {
            t.join(settings.shutdownGrace().toMillis());
            if (t.isAlive()) {
                Job job = inFlight.get();
                log.warn("Worker grace period {} elapsed; interrupting job #{}",
                        settings.shutdownGrace(), job != null ? job.id() : null);
                t.interrupt();
                t.join(1000);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            t.interrupt();
        }
        log.info("Worker stopped lane={}", settings.lane());
    }

    public boolean isRunning() {
        return started.get();
    }

    public Optional<Job> currentJob() {
        return Optional.ofNullable(inFlight.get());
    }

    public WorkerSettings settings() {
        return settings;
    }

    private void pollLoop() {
        while (started.get()) {
            boolean processed;
            try {
                processed = runOnce();
                systemErrorCount = 0;
            } catch (VirtualMachineError e) {
                started.set(false);
                log.error("worker terminated lane={} msg={}", settings.lane(), e.getMessage(), e);
                throw e;
            } catch (Throwable t) {
                systemErrorCount++;
                log.error("worker poll failed lane={} msg={}", settings.lane(), t.getMessage(), t);
                if (!pause(backoff(systemErrorCount))) {
                    break;
                }
                continue;
            }

            if (!processed && !pause(settings.pollInterval())) {
                break;
            }
        }
    }

    // false when the worker was asked to stop while waiting
    private boolean pause(Duration d) {
        try {
            return !stopSignal.await(d.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // Exponential backoff for repeated store failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    /**
     * Claims and processes at most one job.
     *
     * @return true if a job was claimed
     */
    public boolean runOnce() {
        Optional<Job> claimed = queue.claimNext(settings.lane(), settings.workerId());
        if (claimed.isEmpty()) {
            return false;
        }
        Job job = claimed.get();
        inFlight.set(job);
        try {
            process(job);
        } finally {
            inFlight.set(null);
        }
        return true;
    }

    private void process(Job job) {
        Optional<JobHandler<?>> handler = registry.find(job.type());
        if (handler.isEmpty()) {
            String error = "No handler registered for job type: " + job.type();
            log.error("worker configuration error lane={} jobId={} msg={}", settings.lane(), job.id(), error);
            queue.fail(job.id(), error);
            return;
        }

        log.info("Processing job #{} ({}) attempt {}/{}", job.id(), job.type(), job.attempts(), job.maxAttempts());
        String output;
        try {
            output = execute(handler.get(), job);
        } catch (JobCancelledException e) {
            log.info("Job #{} ({}) stopped after cancellation", job.id(), job.type());
            return;
        } catch (Throwable t) {
            String error = errorText(t);
            log.error("job failed id={} type={} msg={}", job.id(), job.type(), error, t);
            queue.fail(job.id(), error);
            if (t instanceof VirtualMachineError) {
                throw (VirtualMachineError) t;
            }
            return;
        }

        if (queue.complete(job.id(), output)) {
            log.info("Job #{} ({}) completed", job.id(), job.type());
        }
    }

    private <T> String execute(JobHandler<T> handler, Job job) throws Exception {
        T payload;
        try {
            payload = objectMapper.convertValue(job.payload(), handler.payloadClass());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid payload for job type " + job.type() + ": " + e.getMessage(), e);
        }
        return handler.execute(payload, new JobContext(job, queue));
    }

    private static String errorText(Throwable t) {
        String msg = t.getMessage();
        return (msg == null || msg.isBlank()) ? t.getClass().getName() : msg;
    }
}
