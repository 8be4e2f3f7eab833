package br.edu.ifba.ragflow.pipe;

import br.edu.ifba.ragflow.logging.RunContext;
import br.edu.ifba.ragflow.logging.RunLoggingProvider;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Run-scoped log channel of one pipe invocation.
 *
 * <p>Entries go into a bounded queue and are forwarded to the {@link RunLoggingProvider} one
 * at a time by a background drain task. {@link #log} never blocks: once the queue holds
 * {@code capacity} entries further entries are dropped and counted in {@link #droppedCount()}.</p>
 *
 * <p>{@link #close()} discards whatever is still queued, cancels the drain task and waits for
 * it to stop. It is idempotent and is called by {@link AsyncPipe} on every exit path.</p>
 */
public final class PipeLogChannel implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PipeLogChannel.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();

    private final String pipeName;
    private final RunContext runContext;
    private final RunLoggingProvider provider;
    private final BlockingQueue<Entry> queue;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CountDownLatch finished = new CountDownLatch(1);
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();

    @Nullable
    private Future<?> drainTask;

    private PipeLogChannel(
            @NotNull String pipeName,
            @NotNull RunContext runContext,
            @NotNull RunLoggingProvider provider,
            int capacity) {
        this.pipeName = pipeName;
        this.runContext = runContext;
        this.provider = provider;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Opens a channel and starts its drain task.
     *
     * @param pipeName owning pipe, used for attribution
     * @param runContext run the entries belong to
     * @param provider sink receiving the entries
     * @param capacity maximum number of queued entries
     * @param executor executor running the drain task
     */
    @NotNull
    public static PipeLogChannel open(
            @NotNull String pipeName,
            @NotNull RunContext runContext,
            @NotNull RunLoggingProvider provider,
            int capacity,
            @NotNull ExecutorService executor) {
        PipeLogChannel channel = new PipeLogChannel(pipeName, runContext, provider, capacity);
        try {
            channel.drainTask = executor.submit(channel::drain);
        } catch (RejectedExecutionException e) {
            logger.warn("Log drain for pipe {} could not be scheduled, entries will be discarded: {}",
                    pipeName, e.getMessage());
        }
        return channel;
    }

    /**
     * Queues a log entry without blocking.
     *
     * @param key log key
     * @param value value; strings are logged as is, other values as JSON
     * @return true if queued, false if dropped
     */
    public boolean log(@NotNull String key, @Nullable Object value) {
        if (closed.get()) {
            dropped.incrementAndGet();
            return false;
        }
        boolean queued = queue.offer(new Entry(key, serialize(value)));
        if (!queued) {
            long count = dropped.incrementAndGet();
            logger.debug("Log queue of pipe {} is full, dropped entry {} (dropped so far: {})",
                    pipeName, key, count);
        }
        return queued;
    }

    public long droppedCount() {
        return dropped.get();
    }

    public long deliveredCount() {
        return delivered.get();
    }

    public long discardedCount() {
        return discarded.get();
    }

    /**
     * Returns the number of entries still waiting in the queue.
     */
    public int pendingCount() {
        return queue.size();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Checks whether the drain task is still running.
     */
    public boolean isDraining() {
        return started.get() && finished.getCount() > 0;
    }

    @NotNull
    public RunContext getRunContext() {
        return runContext;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        List<Entry> remaining = new ArrayList<>();
        queue.drainTo(remaining);
        discarded.addAndGet(remaining.size());

        if (drainTask != null) {
            drainTask.cancel(true);
        }
        if (started.compareAndSet(false, true)) {
            // the drain never ran and will exit as soon as it starts
            finished.countDown();
        } else {
            try {
                finished.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.debug("Interrupted while waiting for log drain of pipe {}", pipeName);
            }
        }
        if (remaining.size() > 0 || dropped.get() > 0) {
            logger.debug("Closed log channel of pipe {}: delivered={}, discarded={}, dropped={}",
                    pipeName, delivered.get(), discarded.get(), dropped.get());
        }
    }

    private void drain() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            while (!closed.get()) {
                Entry entry = queue.take();
                forward(entry);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            finished.countDown();
        }
    }

    private void forward(Entry entry) throws InterruptedException {
        try {
            provider.log(runContext.runId(), entry.key(), entry.value()).get();
            delivered.incrementAndGet();
        } catch (ExecutionException e) {
            logger.warn("Failed to write log entry {} of pipe {} for run {}: {}",
                    entry.key(), pipeName, runContext.runId(), e.getCause().getMessage());
        } catch (RuntimeException e) {
            logger.warn("Failed to write log entry {} of pipe {} for run {}: {}",
                    entry.key(), pipeName, runContext.runId(), e.getMessage());
        }
    }

    private static String serialize(@Nullable Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String text) {
            return text;
        }
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            logger.debug("Could not serialize log value of type {}, using toString(): {}",
                    value.getClass().getName(), e.getMessage());
            return String.valueOf(value);
        }
    }

    private record Entry(String key, String value) {}
}
