package br.edu.ifba.ragflow.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Produces the executor shared by pipe log drains, search branches and RAG searches.
 */
@ApplicationScoped
public class ExecutorProducer {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorProducer.class);

    public static final String PIPELINE_EXECUTOR = "ragflow-pipeline";

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    @Produces
    @Singleton
    @Named(PIPELINE_EXECUTOR)
    public ExecutorService pipelineExecutor(RagFlowConfig config) {
        String namePrefix = config.executor().namePrefix();
        logger.info("Creating pipeline executor with namePrefix: {}", namePrefix);
        return newPipelineExecutor(namePrefix);
    }

    public void shutdown(@Disposes @Named(PIPELINE_EXECUTOR) ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                List<Runnable> pending = executor.shutdownNow();
                logger.warn("Pipeline executor did not terminate in {}s, cancelled {} pending tasks",
                        SHUTDOWN_TIMEOUT_SECONDS, pending.size());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Creates a cached pool of daemon threads named {@code <namePrefix>-<n>}.
     */
    public static ExecutorService newPipelineExecutor(String namePrefix) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r);
            t.setName(namePrefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newCachedThreadPool(threadFactory);
    }
}
