package br.edu.ifba.ragflow.pipeline;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Bounded FIFO between the search producer and one branch.
 *
 * <p>The producer calls {@link #put} for every item and {@link #close()} once at the end,
 * which enqueues a single end-of-stream sentinel. The branch reads the items through
 * {@link #consume()}; the sentinel terminates that stream and is never handed out.
 * Either side may call {@link #abandon()} to stop early: a blocked producer moves on and a
 * blocked consumer sees the end of the stream.</p>
 */
public final class BranchQueue {

    private static final Logger logger = LoggerFactory.getLogger(BranchQueue.class);

    private static final Object SENTINEL = new Object();
    private static final long OFFER_TIMEOUT_MILLIS = 50;
    private static final long POLL_TIMEOUT_MILLIS = 50;

    private final String name;
    private final BlockingQueue<Object> queue;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean abandoned = new AtomicBoolean(false);
    private final AtomicBoolean consumed = new AtomicBoolean(false);

    public BranchQueue(@NotNull String name, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1, got " + capacity);
        }
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Enqueues an item, blocking while the queue is full.
     *
     * @return true if enqueued, false if the branch abandoned the queue
     * @throws IllegalStateException if the queue was already closed
     * @throws InterruptedException if interrupted while waiting for space
     */
    public boolean put(@NotNull Object item) throws InterruptedException {
        Objects.requireNonNull(item, "Branch items must not be null");
        if (closed.get()) {
            throw new IllegalStateException("Branch queue " + name + " is closed");
        }
        while (!abandoned.get()) {
            if (queue.offer(item, OFFER_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Marks the end of the input by enqueuing the sentinel. Only the first call has an effect.
     */
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        boolean interrupted = false;
        try {
            while (!abandoned.get()) {
                try {
                    if (queue.offer(SENTINEL, OFFER_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
                        return;
                    }
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Gives up on the remaining items. Pending and future puts return immediately, and the
     * consumer's stream ends without delivering what was still queued.
     */
    public void abandon() {
        if (abandoned.compareAndSet(false, true)) {
            int dropped = queue.size();
            queue.clear();
            // wakes a consumer parked on an empty queue; the poll timeout covers a lost race
            queue.offer(SENTINEL);
            if (dropped > 0) {
                logger.debug("Branch queue {} abandoned with {} pending items", name, dropped);
            }
        }
    }

    /**
     * Returns the items as a lazy stream that ends at the sentinel.
     * A queue can be consumed once.
     */
    @NotNull
    public Stream<Object> consume() {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("Branch queue " + name + " is already being consumed");
        }
        Iterator<Object> iterator = new Iterator<>() {
            private Object pending;
            private boolean finished;

            @Override
            public boolean hasNext() {
                if (pending != null) {
                    return true;
                }
                if (finished) {
                    return false;
                }
                try {
                    while (true) {
                        if (abandoned.get()) {
                            finished = true;
                            return false;
                        }
                        Object item = queue.poll(POLL_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
                        if (item == SENTINEL) {
                            finished = true;
                            return false;
                        }
                        if (item != null) {
                            pending = item;
                            return true;
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    CancellationException cancellation =
                            new CancellationException("Interrupted while reading branch queue " + name);
                    cancellation.initCause(e);
                    throw cancellation;
                }
            }

            @Override
            public Object next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Object item = pending;
                pending = null;
                return item;
            }
        };
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED), false);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public boolean isAbandoned() {
        return abandoned.get();
    }

    @NotNull
    public String getName() {
        return name;
    }
}
