package com.seiscatalog;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Bounded fan-out over a list of inputs. Results are written back by input
 * index, so the output order never depends on pool size or scheduling.
 */
public class WorkerPool {

    private static final int QUEUE_CAPACITY = 64;

    private final String name;
    private final int threads;

    public WorkerPool(String name, int threads) {
        this.name = name;
        this.threads = Math.max(1, threads);
    }

    public int getThreads() {
        return threads;
    }

    /**
     * Apply {@code task} to every input and return the results in input order.
     * A size-1 pool runs inline on the calling thread.
     */
    public <T, R> List<R> map(List<T> inputs, Function<? super T, ? extends R> task) {
        if (inputs.isEmpty()) {
            return new ArrayList<>();
        }
        if (threads == 1 || inputs.size() == 1) {
            List<R> results = new ArrayList<>(inputs.size());
            for (T input : inputs) {
                results.add(task.apply(input));
            }
            return results;
        }

        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                threads,
                threads,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(QUEUE_CAPACITY),
                workerFactory(),
                new ThreadPoolExecutor.CallerRunsPolicy() // backpressure instead of rejection
        );

        Object[] slots = new Object[inputs.size()];
        List<Future<?>> futures = new ArrayList<>(inputs.size());
        try {
            for (int i = 0; i < inputs.size(); i++) {
                final int index = i;
                final T input = inputs.get(i);
                futures.add(executor.submit(() -> {
                    slots[index] = task.apply(input);
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(name + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException(name + " task failed: " + cause.getMessage(), cause);
        } finally {
            executor.shutdownNow();
        }

        @SuppressWarnings("unchecked")
        List<R> results = (List<R>) new ArrayList<>(Arrays.asList(slots));
        return results;
    }

    private ThreadFactory workerFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, name + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
