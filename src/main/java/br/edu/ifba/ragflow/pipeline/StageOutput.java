package br.edu.ifba.ragflow.pipeline;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Output of one stage within a single pipeline run.
 *
 * <p>The underlying stream is opened on first pull. A retaining output buffers every item it
 * yields, so several readers can consume the same output without executing the stage twice:
 * the successor stage reads it through {@link #stream()}, while a downstream stage that
 * references this one by name forces it with {@link #materialize()} first.</p>
 *
 * <p>An output that no later stage references is pass-through: it allows one cursor and
 * holds at most the item that cursor is about to take.</p>
 *
 * <p>{@link #close()} does not wait for a reader blocked inside the stage, so another thread
 * can close the output to cancel a pull in progress.</p>
 */
public final class StageOutput implements AutoCloseable {

    private final String stageName;
    private final Supplier<? extends Stream<?>> opener;
    private final boolean retain;
    private final List<Object> buffer = new ArrayList<>();
    private int handedOut;
    private boolean cursorOpened;

    @Nullable
    private volatile Stream<?> source;
    @Nullable
    private Iterator<?> iterator;
    private boolean exhausted;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public StageOutput(@NotNull String stageName, @NotNull Supplier<? extends Stream<?>> opener) {
        this(stageName, opener, true);
    }

    /**
     * @param retain whether to keep every item for replay and {@link #materialize()}
     */
    public StageOutput(@NotNull String stageName, @NotNull Supplier<? extends Stream<?>> opener, boolean retain) {
        this.stageName = stageName;
        this.opener = opener;
        this.retain = retain;
    }

    @NotNull
    public String getStageName() {
        return stageName;
    }

    /**
     * Returns a new cursor over the output, starting with the first item.
     * Closing the cursor leaves the output open for other readers.
     *
     * @throws IllegalStateException if a pass-through output already handed out its cursor
     */
    @NotNull
    public synchronized Stream<Object> stream() {
        if (!retain && cursorOpened) {
            throw new IllegalStateException("Stage " + stageName + " does not retain its output for a second reader");
        }
        cursorOpened = true;
        Iterator<Object> cursor = new Iterator<>() {
            private int index;

            @Override
            public boolean hasNext() {
                return fetch(index);
            }

            @Override
            public Object next() {
                if (!hasNext()) {
                    throw new NoSuchElementException("Stage " + stageName + " has no more output");
                }
                return itemAt(index++);
            }
        };
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(cursor, Spliterator.ORDERED), false);
    }

    /**
     * Pulls the remaining output into the buffer.
     *
     * @return every item the stage produced, in order
     * @throws IllegalStateException if the output is pass-through
     */
    @NotNull
    public synchronized List<Object> materialize() {
        if (!retain) {
            throw new IllegalStateException("Stage " + stageName + " does not retain its output");
        }
        while (fetch(buffer.size())) {
            // keep pulling
        }
        return Collections.unmodifiableList(new ArrayList<>(buffer));
    }

    /**
     * Checks whether the stage has been started.
     */
    public boolean isOpened() {
        return source != null;
    }

    public synchronized boolean isExhausted() {
        return exhausted || closed.get();
    }

    public boolean isRetaining() {
        return retain;
    }

    /**
     * Returns the number of items currently held in memory.
     */
    public synchronized int bufferedCount() {
        return buffer.size();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Stream<?> opened = source;
        if (opened != null) {
            opened.close();
        }
    }

    private synchronized Object itemAt(int index) {
        if (retain) {
            return buffer.get(index);
        }
        handedOut++;
        return buffer.remove(0);
    }

    private synchronized boolean fetch(int index) {
        if (index < handedOut + buffer.size()) {
            return true;
        }
        if (exhausted || closed.get()) {
            return false;
        }
        if (source == null) {
            Stream<?> opened = opener.get();
            source = opened;
            iterator = opened.iterator();
            if (closed.get()) {
                // closed while opening; the stream's close handlers run once
                opened.close();
                return false;
            }
        }
        if (iterator.hasNext()) {
            buffer.add(iterator.next());
            return true;
        }
        exhausted = true;
        return false;
    }

    @Override
    public String toString() {
        return "StageOutput{stage=" + stageName + ", buffered=" + bufferedCount() + '}';
    }
}
