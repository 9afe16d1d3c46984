package com.chatrelay.autoreply.queue;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Serializes asynchronous tasks per conversation: tasks for the same
 * conversation run one at a time in enqueue order, tasks for different
 * conversations run independently.
 * <p>
 * Only the tail of each conversation's chain is tracked. Each
 * {@link #enqueue} atomically swaps in a new tail marker and chains its task
 * after the previous marker. Markers always complete normally, so a failed
 * task never blocks the one behind it. When a task finishes, its entry is
 * removed only if its own marker is still the tail
 * ({@code remove(key, marker)} compares by identity); otherwise a newer task
 * owns the cleanup.
 * <p>
 * A conversation is busy from its first enqueue until its chain drains. The
 * no-arg and thread-count constructors own their worker pool and release it
 * in {@link #close()}; an injected executor is left to its owner. Tasks
 * cannot be cancelled once enqueued.
 */
@Slf4j
public class ConversationQueue implements AutoCloseable {

    private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();
    private final Executor executor;
    private final ExecutorService ownedExecutor;

    public ConversationQueue() {
        this(0);
    }

    /**
     * @param workerThreads fixed pool size, or 0 for an unbounded cached pool
     */
    public ConversationQueue(int workerThreads) {
        this.ownedExecutor = workerThreads > 0
                ? Executors.newFixedThreadPool(workerThreads, workerThreadFactory())
                : Executors.newCachedThreadPool(workerThreadFactory());
        this.executor = ownedExecutor;
        log.info("Conversation queue started with {} worker pool",
                workerThreads > 0 ? workerThreads + "-thread" : "cached");
    }

    public ConversationQueue(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownedExecutor = null;
    }

    /**
     * Whether the conversation has a task queued or running.
     */
    public boolean isBusy(String conversationId) {
        return conversationId != null && tails.containsKey(conversationId);
    }

    /**
     * Number of conversations that currently have work in flight.
     */
    public int activeConversations() {
        return tails.size();
    }

    /**
     * Append a task to the conversation's chain and return immediately.
     * <p>
     * The task starts on the worker pool after every previously enqueued task
     * for the same conversation has finished, successfully or not. The returned
     * future completes with the task's outcome (including its failure) after
     * the conversation's bookkeeping has been updated.
     *
     * @param conversationId chain key
     * @param task           produces the task's future when started
     * @param <T>            result type
     */
    public <T> CompletableFuture<T> enqueue(String conversationId, Supplier<CompletableFuture<T>> task) {
        return enqueue(conversationId, task, null);
    }

    /**
     * Like {@link #enqueue(String, Supplier)}, but runs {@code onQueuedBehind}
     * on the calling thread when the conversation already had work in flight.
     * The decision comes from the same atomic tail swap that chains the task,
     * so of several concurrent callers on an idle conversation exactly one skips
     * the hook. The task additionally waits for the hook's future; a failed hook
     * does not block it.
     *
     * @param onQueuedBehind invoked only when queued behind unfinished work; may be null
     */
    public <T> CompletableFuture<T> enqueue(String conversationId, Supplier<CompletableFuture<T>> task,
            Supplier<CompletableFuture<Void>> onQueuedBehind) {
        Objects.requireNonNull(conversationId, "conversationId");
        Objects.requireNonNull(task, "task");

        CompletableFuture<Void> marker = new CompletableFuture<>();
        CompletableFuture<Void> previous = tails.put(conversationId, marker);
        CompletableFuture<Void> ready = previous != null ? previous : CompletableFuture.completedFuture(null);
        if (previous != null && onQueuedBehind != null) {
            CompletableFuture<Void> hookDone = start(onQueuedBehind).handle((result, ex) -> {
                if (ex != null) {
                    log.debug("Queued-behind hook for {} failed: {}", conversationId, ex.toString());
                }
                return null;
            });
            ready = previous.thenCombine(hookDone, (a, b) -> null);
        }

        return ready
                .thenComposeAsync(ignored -> start(task), executor)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.debug("Queued task for {} failed: {}", conversationId, ex.toString());
                    }
                    if (tails.remove(conversationId, marker)) {
                        log.debug("Conversation {} drained", conversationId);
                    }
                    marker.complete(null);
                });
    }

    /**
     * Execute a synchronous task in the conversation's chain.
     */
    public CompletableFuture<Void> enqueueSync(String conversationId, Runnable task) {
        Objects.requireNonNull(task, "task");
        return enqueue(conversationId, () -> {
            task.run();
            return CompletableFuture.completedFuture(null);
        });
    }

    private static <T> CompletableFuture<T> start(Supplier<CompletableFuture<T>> task) {
        try {
            CompletableFuture<T> started = task.get();
            return started != null ? started : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Shut down the owned worker pool. Tasks that have not started yet fail with
     * a rejected-execution error; their conversations still drain.
     */
    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            log.info("Conversation queue stopped ({} conversation(s) still active)", tails.size());
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "conversation-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
