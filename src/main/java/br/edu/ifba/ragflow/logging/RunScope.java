package br.edu.ifba.ragflow.logging;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An open run registration. Closing it releases the registration exactly once.
 */
public final class RunScope implements AutoCloseable {

    private final RunManager manager;
    private final RunContext context;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    RunScope(@NotNull RunManager manager, @NotNull RunContext context) {
        this.manager = manager;
        this.context = context;
    }

    @NotNull
    public RunContext context() {
        return context;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            manager.release(context);
        }
    }
}
