package br.edu.ifba.ragflow.pipe;

import br.edu.ifba.ragflow.logging.RunContext;
import br.edu.ifba.ragflow.logging.RunLoggingProvider;
import br.edu.ifba.ragflow.state.AsyncState;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Base class of every processing stage.
 *
 * <p>Subclasses implement {@link #logic} and return a lazy stream; nothing runs until the
 * returned stream is pulled. Each invocation of {@link #run} gets its own
 * {@link PipeLogChannel}, which is torn down when the stream is exhausted, when pulling it
 * throws, or when the consumer closes it early. Exceptions from the logic are never wrapped
 * and never retried.</p>
 *
 * <h2>Example:</h2>
 * <pre>{@code
 * class UppercasePipe extends AsyncPipe<String, String> {
 *     UppercasePipe(RunLoggingProvider provider, ExecutorService executor) {
 *         super(PipeConfig.of("uppercase"), provider, executor);
 *     }
 *
 *     protected Stream<String> logic(PipeInput<String> input, AsyncState state,
 *                                    RunContext runContext, PipeLogChannel log) {
 *         return input.message().map(String::toUpperCase);
 *     }
 * }
 * }</pre>
 *
 * @param <I> input item type
 * @param <O> output item type
 */
public abstract class AsyncPipe<I, O> {

    private static final Logger logger = LoggerFactory.getLogger(AsyncPipe.class);

    public static final String MDC_RUN_ID = "run.id";
    public static final String MDC_PIPE_NAME = "pipe.name";

    private final PipeConfig config;
    private final RunLoggingProvider loggingProvider;
    private final ExecutorService executor;

    protected AsyncPipe(
            @NotNull PipeConfig config,
            @NotNull RunLoggingProvider loggingProvider,
            @NotNull ExecutorService executor) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.loggingProvider = Objects.requireNonNull(loggingProvider, "loggingProvider must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /**
     * Invokes the pipe.
     *
     * @param input message stream, bound fields and settings
     * @param state per-run state store
     * @param runContext run the invocation belongs to
     * @return lazy output stream; close it when abandoning it before exhaustion
     */
    @NotNull
    public final Stream<O> run(
            @NotNull PipeInput<I> input,
            @NotNull AsyncState state,
            @NotNull RunContext runContext) {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(runContext, "runContext must not be null");

        PipeLogChannel channel = PipeLogChannel.open(
                getName(), runContext, loggingProvider, config.maxLogQueueSize(), executor);
        GuardedIterator iterator = new GuardedIterator(input, state, runContext, channel);
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED), false)
                .onClose(iterator::close);
    }

    /**
     * Produces the output stream of one invocation.
     *
     * @param input message stream, bound fields and settings
     * @param state per-run state store; publish under {@link #getName()}
     * @param runContext run the invocation belongs to
     * @param log run-scoped log channel
     * @return lazy output stream
     */
    @NotNull
    protected abstract Stream<O> logic(
            @NotNull PipeInput<I> input,
            @NotNull AsyncState state,
            @NotNull RunContext runContext,
            @NotNull PipeLogChannel log);

    @NotNull
    public String getName() {
        return config.name();
    }

    @NotNull
    public PipeConfig getConfig() {
        return config;
    }

    @NotNull
    protected ExecutorService getExecutor() {
        return executor;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + getName() + '}';
    }

    /**
     * Pulls from the logic's stream and tears the invocation down exactly once.
     */
    private final class GuardedIterator implements Iterator<O> {

        private final PipeInput<I> input;
        private final AsyncState state;
        private final RunContext runContext;
        private final PipeLogChannel channel;
        private final AtomicBoolean tornDown = new AtomicBoolean(false);

        @Nullable
        private Stream<O> output;
        @Nullable
        private Iterator<O> delegate;

        GuardedIterator(PipeInput<I> input, AsyncState state, RunContext runContext, PipeLogChannel channel) {
            this.input = input;
            this.state = state;
            this.runContext = runContext;
            this.channel = channel;
        }

        @Override
        public boolean hasNext() {
            if (tornDown.get()) {
                return false;
            }
            try {
                if (delegate == null) {
                    logger.debug("Starting pipe {} in run {}", getName(), runContext.runId());
                    output = Objects.requireNonNull(
                            logic(input, state, runContext, channel),
                            "logic of pipe " + getName() + " returned null");
                    delegate = output.iterator();
                }
                boolean hasNext = delegate.hasNext();
                if (!hasNext) {
                    logger.debug("Pipe {} finished in run {}", getName(), runContext.runId());
                    close();
                }
                return hasNext;
            } catch (RuntimeException | Error e) {
                fail(e);
                throw e;
            }
        }

        @Override
        public O next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Pipe " + getName() + " has no more output");
            }
            try {
                return delegate.next();
            } catch (RuntimeException | Error e) {
                fail(e);
                throw e;
            }
        }

        private void fail(Throwable e) {
            MDC.put(MDC_RUN_ID, runContext.runId().toString());
            MDC.put(MDC_PIPE_NAME, getName());
            try {
                logger.debug("Pipe {} failed in run {}: {}", getName(), runContext.runId(), e.toString());
            } finally {
                MDC.remove(MDC_RUN_ID);
                MDC.remove(MDC_PIPE_NAME);
            }
            close();
        }

        void close() {
            if (!tornDown.compareAndSet(false, true)) {
                return;
            }
            try {
                channel.close();
            } finally {
                try {
                    if (output != null) {
                        output.close();
                    }
                } finally {
                    input.message().close();
                }
            }
        }
    }
}
