// file: src/main/java/io/eventchat/server/loop/ChatEventLoop.java
package io.eventchat.server.loop;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The single thread that owns all chat state.
 * <p>
 * Every hub, synchronizer and session mutation is submitted here, so none of
 * those structures need locks. Tasks run one at a time in submission order.
 * <p>
 * Two entry points:
 *  - {@link #execute(Runnable)}: fire and forget; a failing task is logged and
 *    does not stop the loop.
 *  - {@link #call(Supplier, Duration)}: run a task and wait for its result,
 *    for HTTP handlers that read or change chat state. Runs inline when the
 *    caller is already on the loop.
 */
public final class ChatEventLoop implements AutoCloseable {
    private static final Logger log = Logger.getLogger(ChatEventLoop.class.getName());

    public static final String THREAD_NAME = "chat-loop";

    private final ExecutorService executor;
    private volatile Thread loopThread;

    public ChatEventLoop() {
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, THREAD_NAME);
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
    }

    public boolean inLoop() {
        return Thread.currentThread() == loopThread;
    }

    public void execute(Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.log(Level.WARNING, "chat loop task failed", e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.log(Level.FINE, "chat loop is shut down; task dropped", e);
        }
    }

    /**
     * Run {@code task} on the loop and wait at most {@code timeout} for its result.
     * Runtime exceptions thrown by the task are rethrown to the caller as is.
     */
    public <T> T call(Supplier<T> task, Duration timeout) {
        if (inLoop()) {
            return task.get();
        }
        Callable<T> callable = task::get;
        Future<T> f;
        try {
            f = executor.submit(callable);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("chat loop is shut down", e);
        }
        try {
            return f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException("chat loop task failed", cause);
        } catch (TimeoutException e) {
            f.cancel(false);
            throw new IllegalStateException("chat loop did not answer within " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for chat loop", e);
        }
    }

    /** Stop accepting work and wait briefly for queued tasks. */
    @Override
    public void close() {
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
}
