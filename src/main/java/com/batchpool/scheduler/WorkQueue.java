package com.batchpool.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Three FIFO sub-queues, one per {@link JobPriority}, drained strictly
 * HIGH before NORMAL before LOW.
 * <p>
 * Every operation runs under a single monitor, so {@code size()} always equals
 * the sum of the sub-queue sizes. LOW items can starve under a steady stream of
 * HIGH items; there is no aging.
 *
 * @param <I> Input reference type
 */
public class WorkQueue<I> {

    private static final Logger log = LoggerFactory.getLogger(WorkQueue.class);

    private static final JobPriority[] DRAIN_ORDER = {JobPriority.HIGH, JobPriority.NORMAL, JobPriority.LOW};

    private final Map<JobPriority, ArrayDeque<WorkItem<I>>> queues = new EnumMap<>(JobPriority.class);
    private final Object lock = new Object();
    private int totalItems;

    public WorkQueue() {
        for (JobPriority priority : JobPriority.values()) {
            queues.put(priority, new ArrayDeque<>());
        }
    }

    /**
     * Append an item to the tail of its priority's sub-queue.
     */
    public void add(WorkItem<I> item) {
        synchronized (lock) {
            queues.get(item.priority()).addLast(item);
            totalItems++;
            log.trace("Job {} queued as {}, total: {}", item.id(), item.priority(), totalItems);
        }
    }

    /**
     * Remove the head of the highest non-empty priority.
     */
    public Optional<WorkItem<I>> poll() {
        return poll(item -> true);
    }

    /**
     * Remove the first item matching {@code filter}, scanning priorities in drain order
     * and each sub-queue from its head.
     */
    public Optional<WorkItem<I>> poll(Predicate<? super WorkItem<I>> filter) {
        synchronized (lock) {
            for (JobPriority priority : DRAIN_ORDER) {
                Iterator<WorkItem<I>> it = queues.get(priority).iterator();
                while (it.hasNext()) {
                    WorkItem<I> item = it.next();
                    if (filter.test(item)) {
                        it.remove();
                        totalItems--;
                        return Optional.of(item);
                    }
                }
            }
            return Optional.empty();
        }
    }

    /**
     * Remove every queued item matching {@code filter}.
     *
     * @return the removed items in drain order
     */
    public List<WorkItem<I>> removeIf(Predicate<? super WorkItem<I>> filter) {
        synchronized (lock) {
            List<WorkItem<I>> removed = new ArrayList<>();
            for (JobPriority priority : DRAIN_ORDER) {
                Iterator<WorkItem<I>> it = queues.get(priority).iterator();
                while (it.hasNext()) {
                    WorkItem<I> item = it.next();
                    if (filter.test(item)) {
                        it.remove();
                        removed.add(item);
                    }
                }
            }
            totalItems -= removed.size();
            return removed;
        }
    }

    /**
     * Discard every queued item.
     *
     * @return number of items discarded
     */
    public int clear() {
        synchronized (lock) {
            int cleared = totalItems;
            for (ArrayDeque<WorkItem<I>> queue : queues.values()) {
                queue.clear();
            }
            totalItems = 0;
            return cleared;
        }
    }

    public int size() {
        synchronized (lock) {
            return totalItems;
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public QueueStatus status() {
        synchronized (lock) {
            return new QueueStatus(
                    queues.get(JobPriority.HIGH).size(),
                    queues.get(JobPriority.NORMAL).size(),
                    queues.get(JobPriority.LOW).size(),
                    totalItems
            );
        }
    }
}
