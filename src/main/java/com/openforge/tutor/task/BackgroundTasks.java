package com.openforge.tutor.task;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Detached side effects that must never reach the student's turn:
 * interaction logging, evidence recording, adaptation logging, profile
 * enrichment and correction persistence.
 *
 * Each task is labelled; a failure is logged with its label and swallowed.
 * The returned future always completes normally, so tests can join on it
 * without try/catch.
 */
@Slf4j
@Component
public class BackgroundTasks {

    private final Executor executor;

    public BackgroundTasks(@Qualifier("tutorTaskExecutor") Executor executor) {
        this.executor = executor;
    }

    public CompletableFuture<Void> submit(String label, Runnable task) {
        try {
            return CompletableFuture.runAsync(() -> runLogged(label, task), executor);
        } catch (RejectedExecutionException e) {
            log.warn("[Background] '{}' rejected, executor is shutting down", label);
            return CompletableFuture.completedFuture(null);
        }
    }

    private static void runLogged(String label, Runnable task) {
        long start = System.currentTimeMillis();
        try {
            task.run();
            log.debug("[Background] '{}' done in {}ms", label, System.currentTimeMillis() - start);
        } catch (Exception e) {
            log.error("[Background] '{}' failed: {}", label, e.getMessage(), e);
        }
    }
}
