package br.edu.ifba.ragflow.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class FutureUtilTest {

    @Test
    @DisplayName("should return the value of a completed future")
    void shouldReturnValue() {
        assertEquals("done", FutureUtil.await(CompletableFuture.completedFuture("done")));
    }

    @Test
    @DisplayName("should rethrow the original unchecked exception")
    void shouldUnwrapRuntimeException() {
        IllegalArgumentException cause = new IllegalArgumentException("bad");
        CompletableFuture<String> failed = CompletableFuture.supplyAsync(() -> {
            throw cause;
        });

        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class, () -> FutureUtil.await(failed));
        assertSame(cause, thrown);
    }

    @Test
    @DisplayName("should wrap checked causes in CompletionException")
    void shouldWrapCheckedCause() {
        CompletableFuture<String> failed = CompletableFuture.failedFuture(new IOException("io"));

        CompletionException thrown = assertThrows(CompletionException.class, () -> FutureUtil.await(failed));
        assertInstanceOf(IOException.class, thrown.getCause());
    }

    @Test
    @DisplayName("should surface cancellation")
    void shouldSurfaceCancellation() {
        CompletableFuture<String> future = new CompletableFuture<>();
        future.cancel(true);

        assertThrows(CancellationException.class, () -> FutureUtil.await(future));
    }

    @Test
    @DisplayName("should strip nested wrapper layers")
    void shouldUnwrapNestedLayers() {
        IllegalStateException root = new IllegalStateException("root");
        Throwable wrapped = new CompletionException(new ExecutionException(root));

        assertSame(root, FutureUtil.unwrap(wrapped));
    }
}
