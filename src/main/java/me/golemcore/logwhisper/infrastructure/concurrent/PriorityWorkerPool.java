package me.golemcore.logwhisper.infrastructure.concurrent;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.logwhisper.domain.model.ChunkPriority;
import me.golemcore.logwhisper.infrastructure.config.LogWhisperProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Bounded worker pool whose queue is ordered by {@link ChunkPriority}, FIFO
 * within one priority.
 *
 * <p>
 * A queued task may be skipped when it starts: if its {@code stillWanted} check
 * returns {@code false} the work is not run and its future completes with a
 * {@link CancellationException}. Work that already started always runs to
 * completion.
 */
@Component
@Slf4j
public class PriorityWorkerPool {

    private final ThreadPoolExecutor executor;
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong skippedTasks = new AtomicLong();

    public PriorityWorkerPool(LogWhisperProperties properties) {
        int poolSize = Math.max(1, properties.getWorkers().getPoolSize());
        AtomicInteger threadNumber = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(poolSize, poolSize, 60, TimeUnit.SECONDS,
                new PriorityBlockingQueue<>(), r -> {
                    Thread t = new Thread(r, "logwhisper-worker-" + threadNumber.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
        log.info("[Workers] Started pool with {} threads", poolSize);
    }

    public <T> CompletableFuture<T> submit(ChunkPriority priority, Supplier<T> work) {
        return submit(priority, work, () -> true);
    }

    public <T> CompletableFuture<T> submit(ChunkPriority priority, Supplier<T> work, BooleanSupplier stillWanted) {
        CompletableFuture<T> future = new CompletableFuture<>();
        PriorityTask task = new PriorityTask(priority, sequence.getAndIncrement(), () -> {
            if (future.isDone()) {
                return;
            }
            if (!stillWanted.getAsBoolean()) {
                skippedTasks.incrementAndGet();
                future.completeExceptionally(new CancellationException("Skipped stale " + priority + " task"));
                return;
            }
            try {
                future.complete(work.get());
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            } catch (Error e) {
                future.completeExceptionally(e);
                throw e;
            }
        });
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("[Workers] Rejected {} task: {}", priority, e.getMessage());
            future.completeExceptionally(e);
        }
        return future;
    }

    public int getQueuedTasks() {
        return executor.getQueue().size();
    }

    public long getSkippedTasks() {
        return skippedTasks.get();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class PriorityTask implements Runnable, Comparable<PriorityTask> {

        private final ChunkPriority priority;
        private final long sequence;
        private final Runnable body;

        PriorityTask(ChunkPriority priority, long sequence, Runnable body) {
            this.priority = priority;
            this.sequence = sequence;
            this.body = body;
        }

        @Override
        public void run() {
            body.run();
        }

        @Override
        public int compareTo(PriorityTask other) {
            int byPriority = Integer.compare(other.priority.getRank(), priority.getRank());
            return byPriority != 0 ? byPriority : Long.compare(sequence, other.sequence);
        }
    }
}
