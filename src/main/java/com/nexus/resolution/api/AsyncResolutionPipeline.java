package com.nexus.resolution.api;

import com.nexus.resolution.core.model.CandidateEntity;
import com.nexus.resolution.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Staged, bounded variant of {@link ResolutionPipeline}.
 *
 * <pre>
 * submit ─▶ [intake queue] ─▶ scoring workers ─▶ [ambiguous buffer] ─▶ adjudication workers
 *                                   │                                          │
 *                                   └──── merge / create / review ◀────────────┘
 * </pre>
 *
 * <p>Both queues are bounded. {@link #submit} blocks while the intake queue is full, and
 * scoring workers block while the ambiguous buffer is full, so a slow adjudicator slows
 * intake instead of growing memory or outstanding external calls. The number of adjudication
 * workers equals the adjudicator concurrency ceiling.</p>
 */
public class AsyncResolutionPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AsyncResolutionPipeline.class);

    private static final long POLL_MILLIS = 100;

    private final ResolutionPipeline pipeline;
    private final BlockingQueue<Task> intake;
    private final BlockingQueue<AmbiguousTask> ambiguous;
    private final ExecutorService scoringWorkers;
    private final ExecutorService adjudicationWorkers;
    private volatile boolean accepting = true;
    private volatile boolean scoringFinished = false;

    public AsyncResolutionPipeline(ResolutionPipeline pipeline) {
        this.pipeline = pipeline;
        ResolutionOptions options = pipeline.getOptions();
        this.intake = new ArrayBlockingQueue<>(options.getIntakeQueueCapacity());
        this.ambiguous = new ArrayBlockingQueue<>(options.getAmbiguousBufferCapacity());

        int scoringCount = options.getScoringWorkers();
        int adjudicationCount = options.getAdjudicatorMaxConcurrency();
        this.scoringWorkers = Executors.newFixedThreadPool(scoringCount, new WorkerThreadFactory("resolution-scoring-"));
        this.adjudicationWorkers = Executors.newFixedThreadPool(adjudicationCount,
                new WorkerThreadFactory("resolution-adjudication-"));
        for (int i = 0; i < scoringCount; i++) {
            scoringWorkers.execute(this::scoringLoop);
        }
        for (int i = 0; i < adjudicationCount; i++) {
            adjudicationWorkers.execute(this::adjudicationLoop);
        }
        log.info("AsyncResolutionPipeline started: scoringWorkers={}, adjudicationWorkers={}, intake={}, buffer={}",
                scoringCount, adjudicationCount, options.getIntakeQueueCapacity(), options.getAmbiguousBufferCapacity());
    }

    /**
     * Queues a candidate, blocking while the intake queue is full.
     *
     * @throws CandidateValidationException if the candidate is malformed
     * @throws IllegalStateException if the pipeline is closed or the caller is interrupted
     */
    public ResolutionHandle submit(CandidateEntity candidate) {
        Task task = newTask(candidate);
        try {
            intake.put(task);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for intake capacity", e);
        }
        return task.handle();
    }

    /**
     * Queues a candidate if intake capacity frees up within the timeout.
     *
     * @return the handle, or empty if the intake queue stayed full
     */
    public Optional<ResolutionHandle> trySubmit(CandidateEntity candidate, Duration timeout) {
        Task task = newTask(candidate);
        try {
            if (intake.offer(task, timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return Optional.of(task.handle());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Intake full, rejected candidate {}", candidate.ingestionId());
        return Optional.empty();
    }

    public int intakeDepth() {
        return intake.size();
    }

    public int ambiguousDepth() {
        return ambiguous.size();
    }

    private Task newTask(CandidateEntity candidate) {
        if (!accepting) {
            throw new IllegalStateException("AsyncResolutionPipeline is closed");
        }
        pipeline.validate(candidate);
        CancellationToken token = CancellationToken.create();
        ResolutionHandle handle = new ResolutionHandle(candidate.ingestionId(), token, new CompletableFuture<>());
        return new Task(candidate, token, handle, System.nanoTime());
    }

    private void scoringLoop() {
        while (accepting || !intake.isEmpty()) {
            Task task;
            try {
                task = intake.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (task == null || task.handle().isDone()) {
                continue;
            }
            try (LogContext ctx = LogContext.forResolution(LogContext.generateCorrelationId(),
                    task.candidate().ingestionId(), task.candidate().type().name())) {
                ResolutionPipeline.Stage stage = pipeline.score(task.candidate(), task.token());
                if (stage.isDone()) {
                    complete(task, stage.result());
                } else {
                    ambiguous.put(new AmbiguousTask(task, stage.scored()));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                task.handle().future().completeExceptionally(e);
                return;
            } catch (RuntimeException e) {
                fail(task, e);
            }
        }
    }

    private void adjudicationLoop() {
        while (!scoringFinished || !ambiguous.isEmpty()) {
            AmbiguousTask next;
            try {
                next = ambiguous.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (next == null || next.task().handle().isDone()) {
                continue;
            }
            Task task = next.task();
            try (LogContext ctx = LogContext.forResolution(LogContext.generateCorrelationId(),
                    task.candidate().ingestionId(), task.candidate().type().name())) {
                complete(task, pipeline.adjudicate(next.scored(), task.token()));
            } catch (RuntimeException e) {
                fail(task, e);
            }
        }
    }

    private void complete(Task task, ResolutionResult result) {
        pipeline.recordCompletion(result, task.startNanos());
        task.handle().future().complete(result);
    }

    private void fail(Task task, RuntimeException e) {
        if (e instanceof ResolutionCancelledException) {
            log.debug("Resolution of {} cancelled", task.candidate().ingestionId());
        } else {
            log.error("resolution.failed ingestionId={} cause={}", task.candidate().ingestionId(), e.toString(), e);
        }
        task.handle().future().completeExceptionally(e);
    }

    /**
     * Stops intake, lets queued candidates finish, then stops the workers.
     */
    @Override
    public void close() {
        accepting = false;
        try {
            scoringWorkers.shutdown();
            if (!scoringWorkers.awaitTermination(30, TimeUnit.SECONDS)) {
                scoringWorkers.shutdownNow();
            }
            scoringFinished = true;
            adjudicationWorkers.shutdown();
            if (!adjudicationWorkers.awaitTermination(30, TimeUnit.SECONDS)) {
                adjudicationWorkers.shutdownNow();
            }
        } catch (InterruptedException e) {
            scoringWorkers.shutdownNow();
            adjudicationWorkers.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            scoringFinished = true;
            abandonRemaining();
        }
    }

    private void abandonRemaining() {
        List<Task> leftover = new ArrayList<>();
        intake.drainTo(leftover);
        List<AmbiguousTask> leftoverAmbiguous = new ArrayList<>();
        ambiguous.drainTo(leftoverAmbiguous);
        leftoverAmbiguous.forEach(a -> leftover.add(a.task()));
        for (Task task : leftover) {
            task.handle().future().completeExceptionally(
                    new IllegalStateException("AsyncResolutionPipeline closed before resolution"));
        }
        if (!leftover.isEmpty()) {
            log.warn("resolution.abandoned count={}", leftover.size());
        }
    }

    private record Task(CandidateEntity candidate, CancellationToken token, ResolutionHandle handle, long startNanos) {
    }

    private record AmbiguousTask(Task task, ResolutionPipeline.ScoredCandidate scored) {
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        WorkerThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
