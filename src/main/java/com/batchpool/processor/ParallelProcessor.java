package com.batchpool.processor;

import com.batchpool.config.ProcessorConfig;
import com.batchpool.exception.AdmissionException;
import com.batchpool.exception.BatchPoolException;
import com.batchpool.exception.ResourceException;
import com.batchpool.exception.SchedulingTimeoutException;
import com.batchpool.exception.TransformException;
import com.batchpool.memory.MemoryPool;
import com.batchpool.memory.MemoryTracker;
import com.batchpool.memory.SystemMemory;
import com.batchpool.progress.ProgressState;
import com.batchpool.progress.ProgressTracker;
import com.batchpool.scheduler.JobLease;
import com.batchpool.scheduler.WorkItem;
import com.batchpool.scheduler.WorkScheduler;
import com.batchpool.transform.ItemTransform;
import com.batchpool.transform.TransformContext;
import com.batchpool.transform.TransformOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Runs an {@link ItemTransform} over a batch of inputs and aggregates the results.
 * <p>
 * Push-based batches ({@link #processBatch}) run under one of three strategies:
 * <ul>
 *   <li>ASYNC: one task per item on the worker pool, admitted by a semaphore</li>
 *   <li>CPU_INTENSIVE: parallel map on a work-stealing pool</li>
 *   <li>HYBRID: bounded chunks run one after another with a pause in between</li>
 * </ul>
 * Pull-based batches ({@link #processScheduled}) let workers draw jobs from a
 * {@link WorkScheduler}, which applies priority and memory admission.
 * <p>
 * Item failures are recorded in the result and never stop the batch.
 * Interruption or a broken worker surfaces as {@link ResourceException}.
 */
public class ParallelProcessor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ParallelProcessor.class);

    static final int MAX_CHUNK_SIZE = 10;

    private final ProcessorConfig config;
    private final MemoryPool memoryPool;
    private final ProgressTracker progressTracker;
    private final SystemMemory systemMemory;

    private final ExecutorService threadPool;
    private final ForkJoinPool forkJoinPool;
    private final Semaphore semaphore;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public ParallelProcessor(ProcessorConfig config) {
        this(config, new MemoryPool(), new ProgressTracker(config.progressBufferSize()), SystemMemory.host());
    }

    public ParallelProcessor(ProcessorConfig config,
                             MemoryPool memoryPool,
                             ProgressTracker progressTracker,
                             SystemMemory systemMemory) {
        this.config = config;
        this.memoryPool = memoryPool;
        this.progressTracker = progressTracker;
        this.systemMemory = systemMemory;
        this.semaphore = new Semaphore(config.maxConcurrent());

        AtomicInteger workerIds = new AtomicInteger();
        this.threadPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName(config.threadNamePrefix() + workerIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.forkJoinPool = new ForkJoinPool(config.maxConcurrent(), pool -> {
            ForkJoinWorkerThread t = ForkJoinPool.defaultForkJoinWorkerThreadFactory.newThread(pool);
            t.setName(config.threadNamePrefix() + "fj-" + t.getPoolIndex());
            return t;
        }, null, false);

        log.info("ParallelProcessor initialized with {} concurrent workers, default strategy {}",
                config.maxConcurrent(), config.strategy());
    }

    /**
     * Process a batch with the configured default strategy.
     */
    public <I, C, O extends TransformOutput> BatchProcessingResult<O> processBatch(
            List<I> items, ItemTransform<I, C, O> transform, C transformConfig) {
        return processBatch(items, config.strategy(), transform, transformConfig);
    }

    /**
     * Process a batch, running the transform exactly once per item.
     *
     * @throws ResourceException if interrupted or a worker breaks
     */
    public <I, C, O extends TransformOutput> BatchProcessingResult<O> processBatch(
            List<I> items, ProcessingStrategy strategy, ItemTransform<I, C, O> transform, C transformConfig) {
        ensureOpen();
        ProcessingStrategy resolved = resolve(strategy, items.size());

        log.info("Starting {} processing of {} items", resolved, items.size());
        progressTracker.start(items.size());
        long start = System.nanoTime();

        List<ItemOutcome<O>> outcomes = switch (resolved) {
            case ASYNC -> runAsync(items, transform, transformConfig);
            case CPU_INTENSIVE -> runCpuIntensive(items, transform, transformConfig);
            case HYBRID -> runHybrid(items, transform, transformConfig);
            case AUTO -> throw new IllegalStateException("AUTO must be resolved before dispatch");
        };

        return finish(resolved.name(), outcomes, List.of(), start);
    }

    /**
     * Schedule every input on {@code scheduler} and drain this call's jobs with
     * {@code maxConcurrent} workers. Each job holds a memory reservation for its
     * estimated footprint while it runs. Jobs queued on the same scheduler by anyone
     * else are left alone.
     * <p>
     * If a worker times out waiting for a slot or memory, the workers stop, this call's
     * unstarted jobs are withdrawn from the scheduler and each is recorded as a
     * {@link SchedulingTimeoutException} failure. Items already processed keep their outcomes.
     *
     * @throws ResourceException if interrupted or a worker breaks
     */
    public <I, C, O extends TransformOutput> BatchProcessingResult<O> processScheduled(
            List<I> inputs, WorkScheduler<I> scheduler, ItemTransform<I, C, O> transform, C transformConfig) {
        ensureOpen();
        log.info("Starting scheduled processing of {} items", inputs.size());
        progressTracker.start(inputs.size());
        long start = System.nanoTime();

        List<BatchPoolException> failures = new ArrayList<>();
        Set<Long> admitted = new HashSet<>();
        for (I input : inputs) {
            try {
                admitted.add(scheduler.schedule(input));
            } catch (AdmissionException e) {
                log.warn("Could not schedule {}: {}", input, e.getMessage());
                failures.add(e);
                progressTracker.reportError(transform.describe(input), e.getMessage());
            }
        }
        Predicate<WorkItem<I>> ownJobs = item -> admitted.contains(item.id());

        int workers = scheduler.getConfig().maxConcurrent();
        Queue<ItemOutcome<O>> outcomes = new ConcurrentLinkedQueue<>();
        AtomicReference<SchedulingTimeoutException> timeout = new AtomicReference<>();
        AtomicBoolean stop = new AtomicBoolean(false);

        List<Future<Void>> futures = new ArrayList<>(workers);
        for (int i = 0; i < workers; i++) {
            futures.add(submit(() -> {
                drainScheduler(scheduler, ownJobs, transform, transformConfig, outcomes, timeout, stop);
                return null;
            }));
        }
        try {
            awaitAll(futures);
        } catch (ResourceException e) {
            int withdrawn = scheduler.removeQueued(ownJobs).size();
            log.warn("Scheduled processing failed, withdrew {} unstarted jobs", withdrawn);
            throw e;
        }

        SchedulingTimeoutException stopped = timeout.get();
        if (stopped != null) {
            List<WorkItem<I>> unstarted = scheduler.removeQueued(ownJobs);
            log.warn("Scheduled processing stopped early: {} ({} items not started)",
                    stopped.getMessage(), unstarted.size());
            for (WorkItem<I> item : unstarted) {
                String name = transform.describe(item.input());
                SchedulingTimeoutException failure = stopped.forItem(name);
                failures.add(failure);
                progressTracker.reportError(name, failure.getMessage());
            }
        }

        return finish("scheduled", new ArrayList<>(outcomes), failures, start);
    }

    private <I, C, O extends TransformOutput> void drainScheduler(
            WorkScheduler<I> scheduler,
            Predicate<WorkItem<I>> ownJobs,
            ItemTransform<I, C, O> transform,
            C transformConfig,
            Queue<ItemOutcome<O>> outcomes,
            AtomicReference<SchedulingTimeoutException> timeout,
            AtomicBoolean stop) throws InterruptedException {
        while (!stop.get()) {
            Optional<JobLease<I>> next;
            try {
                next = scheduler.nextJob(ownJobs);
            } catch (SchedulingTimeoutException e) {
                timeout.compareAndSet(null, e);
                stop.set(true);
                return;
            }
            if (next.isEmpty()) {
                return;
            }

            JobLease<I> lease = next.get();
            long jobStart = System.nanoTime();
            boolean success = false;
            try (MemoryTracker reservation = MemoryTracker.acquire(
                    scheduler.getMemoryMonitor(), lease.item().estimatedMemory())) {
                ItemOutcome<O> outcome = runItem(lease.input(), transform, transformConfig);
                success = outcome.isSuccess();
                outcomes.add(outcome);
            } finally {
                scheduler.complete(lease, success, Duration.ofNanos(System.nanoTime() - jobStart));
            }
        }
    }

    private <I, C, O extends TransformOutput> List<ItemOutcome<O>> runAsync(
            List<I> items, ItemTransform<I, C, O> transform, C transformConfig) {
        return awaitAll(submitGated(items, transform, transformConfig));
    }

    private <I, C, O extends TransformOutput> List<ItemOutcome<O>> runCpuIntensive(
            List<I> items, ItemTransform<I, C, O> transform, C transformConfig) {
        try {
            return forkJoinPool.submit(() -> items.parallelStream()
                            .map(item -> runItem(item, transform, transformConfig))
                            .collect(Collectors.toList()))
                    .get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResourceException("Batch processing interrupted", e);
        } catch (ExecutionException e) {
            throw new ResourceException("Worker failed: " + e.getCause(), e.getCause());
        } catch (RejectedExecutionException e) {
            throw new ResourceException("Work-stealing pool rejected the batch", e);
        }
    }

    private <I, C, O extends TransformOutput> List<ItemOutcome<O>> runHybrid(
            List<I> items, ItemTransform<I, C, O> transform, C transformConfig) {
        int chunkSize = chunkSize(items.size(), config.maxConcurrent());
        int chunkCount = (items.size() + chunkSize - 1) / chunkSize;
        List<ItemOutcome<O>> outcomes = new ArrayList<>(items.size());

        for (int chunk = 0; chunk < chunkCount; chunk++) {
            List<I> slice = items.subList(chunk * chunkSize, Math.min(items.size(), (chunk + 1) * chunkSize));
            log.debug("Processing chunk {} of {} ({} items)", chunk + 1, chunkCount, slice.size());
            outcomes.addAll(awaitAll(submitGated(slice, transform, transformConfig)));

            if (chunk < chunkCount - 1 && !config.chunkPause().isZero()) {
                try {
                    Thread.sleep(config.chunkPause().toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ResourceException("Batch processing interrupted between chunks", e);
                }
            }
        }
        return outcomes;
    }

    /**
     * Items per HYBRID chunk: total / concurrency, clamped to [1, 10].
     */
    static int chunkSize(int total, int maxConcurrent) {
        return Math.min(MAX_CHUNK_SIZE, Math.max(1, total / maxConcurrent));
    }

    private <I, C, O extends TransformOutput> List<Future<ItemOutcome<O>>> submitGated(
            List<I> items, ItemTransform<I, C, O> transform, C transformConfig) {
        List<Future<ItemOutcome<O>>> futures = new ArrayList<>(items.size());
        for (I item : items) {
            futures.add(submit(() -> {
                semaphore.acquire();
                try {
                    return runItem(item, transform, transformConfig);
                } finally {
                    semaphore.release();
                }
            }));
        }
        return futures;
    }

    private <T> Future<T> submit(Callable<T> task) {
        try {
            return threadPool.submit(task);
        } catch (RejectedExecutionException e) {
            throw new ResourceException("Worker pool rejected task", e);
        }
    }

    private <T> List<T> awaitAll(List<Future<T>> futures) {
        List<T> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException e) {
                cancelFrom(futures, i);
                Thread.currentThread().interrupt();
                throw new ResourceException("Batch processing interrupted", e);
            } catch (ExecutionException e) {
                cancelFrom(futures, i + 1);
                throw new ResourceException("Worker failed: " + e.getCause(), e.getCause());
            }
        }
        return results;
    }

    private static void cancelFrom(List<? extends Future<?>> futures, int from) {
        for (int i = from; i < futures.size(); i++) {
            futures.get(i).cancel(true);
        }
    }

    /**
     * Run the transform once for one item and report it to the progress tracker.
     */
    private <I, C, O extends TransformOutput> ItemOutcome<O> runItem(
            I item, ItemTransform<I, C, O> transform, C transformConfig) {
        String name = transform.describe(item);
        progressTracker.startFile(name);
        long start = System.nanoTime();

        try {
            O output = transform.transform(item, new TransformContext<>(name, transformConfig, memoryPool));
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            if (output == null) {
                progressTracker.completeFile(name, false, 0, 0, elapsed);
                return ItemOutcome.failure(new TransformException(name, "transform returned no output"));
            }
            progressTracker.completeFile(name, true, output.inputBytes(), output.unitCount(), elapsed);
            return ItemOutcome.success(output);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            progressTracker.completeFile(name, false, 0, 0, Duration.ofNanos(System.nanoTime() - start));
            log.debug("Failed to process {}: {}", name, e.getMessage());
            return ItemOutcome.failure(new TransformException(name, e));
        }
    }

    private <O extends TransformOutput> BatchProcessingResult<O> finish(
            String mode, List<ItemOutcome<O>> outcomes, List<BatchPoolException> earlyFailures, long start) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        BatchProcessingResult<O> result = BatchProcessingResult.aggregate(outcomes, earlyFailures, elapsed);
        progressTracker.completeBatch();
        log.info("{} processing completed in {}s: {} successful, {} failed",
                mode, String.format("%.2f", elapsed.toNanos() / 1_000_000_000.0),
                result.successful(), result.failed());
        return result;
    }

    private ProcessingStrategy resolve(ProcessingStrategy strategy, int itemCount) {
        if (strategy != ProcessingStrategy.AUTO) {
            return strategy;
        }
        ProcessingStrategy chosen = ProcessingStrategy.chooseAuto(itemCount, systemMemory.availableBytes());
        log.debug("AUTO strategy resolved to {} for {} items", chosen, itemCount);
        return chosen;
    }

    private void ensureOpen() {
        if (shutdown.get()) {
            throw new ResourceException("Processor is shut down");
        }
    }

    public ProgressState getProgress() {
        return progressTracker.getState();
    }

    public ProgressTracker getProgressTracker() {
        return progressTracker;
    }

    public MemoryPool getMemoryPool() {
        return memoryPool;
    }

    public ProcessorConfig getConfig() {
        return config;
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    @Override
    public void close() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down ParallelProcessor");
        threadPool.shutdown();
        forkJoinPool.shutdown();
        try {
            if (!threadPool.awaitTermination(5, TimeUnit.SECONDS)) {
                threadPool.shutdownNow();
            }
            if (!forkJoinPool.awaitTermination(5, TimeUnit.SECONDS)) {
                forkJoinPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            threadPool.shutdownNow();
            forkJoinPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
