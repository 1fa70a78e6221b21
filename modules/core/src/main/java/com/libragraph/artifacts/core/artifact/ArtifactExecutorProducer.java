package com.libragraph.artifacts.core.artifact;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@ApplicationScoped
public class ArtifactExecutorProducer {

    @ConfigProperty(name = "artifacts.executor.threads", defaultValue = "8")
    int threads;

    private ExecutorService executor;

    @Produces
    @ApplicationScoped
    @Named("artifactExecutor")
    public ExecutorService artifactExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "artifact-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        executor = Executors.newFixedThreadPool(threads, factory);
        return executor;
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) executor.shutdown();
    }
}
