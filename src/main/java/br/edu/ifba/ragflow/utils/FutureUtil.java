package br.edu.ifba.ragflow.utils;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Helpers for waiting on futures without leaking wrapper exceptions.
 */
public final class FutureUtil {

    private FutureUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Waits for a future and returns its value.
     *
     * <p>A failure is rethrown as the original unchecked exception. Checked causes are wrapped
     * in a {@link CompletionException}. An interrupt restores the thread's flag and surfaces
     * as {@link CancellationException}.</p>
     *
     * @param future future to wait for
     * @return the future's value
     */
    public static <T> T await(@NotNull Future<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancellation = new CancellationException("Interrupted while waiting");
            cancellation.initCause(e);
            throw cancellation;
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        } catch (CompletionException e) {
            throw rethrow(e.getCause());
        }
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} layers.
     */
    @NotNull
    public static Throwable unwrap(@NotNull Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static RuntimeException rethrow(Throwable cause) {
        Throwable unwrapped = unwrap(cause);
        if (unwrapped instanceof RuntimeException runtime) {
            throw runtime;
        }
        if (unwrapped instanceof Error error) {
            throw error;
        }
        throw new CompletionException(unwrapped);
    }
}
