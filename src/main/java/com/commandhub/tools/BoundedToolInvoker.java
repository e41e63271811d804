package com.commandhub.tools;

import com.commandhub.AppLogger;
import com.commandhub.ErrorCode;
import com.commandhub.HubException;
import com.commandhub.credentials.Credential;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs adapter calls on worker threads and waits at most {@code timeoutMs}.
 * A call that overruns is interrupted locally; the remote side effect may
 * still happen.
 */
public class BoundedToolInvoker implements AutoCloseable {

    private final ToolAdapter adapter;
    private final long timeoutMs;
    private final ExecutorService executor;
    private final AppLogger.Channel log = AppLogger.channel("ToolInvoker");

    public BoundedToolInvoker(ToolAdapter adapter, long timeoutMs) {
        this.adapter = adapter;
        this.timeoutMs = timeoutMs > 0 ? timeoutMs : 30_000;
        this.executor = Executors.newCachedThreadPool(workerThreadFactory());
    }

    /**
     * @throws HubException {@link ErrorCode#ADAPTER_TIMEOUT} or {@link ErrorCode#ADAPTER_FAILURE}
     */
    public JsonNode invoke(String tool, Map<String, Object> arguments, Credential credential) {
        Future<JsonNode> future = executor.submit(() -> adapter.invoke(tool, arguments, credential));
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Tool " + tool + " timed out after " + timeoutMs + "ms");
            throw new HubException(ErrorCode.ADAPTER_TIMEOUT,
                "Tool " + tool + " timed out after " + timeoutMs + "ms; the remote effect may still have happened", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof HubException) {
                throw (HubException) cause;
            }
            String message = cause.getMessage();
            if (message == null || message.isBlank()) {
                message = cause.getClass().getSimpleName();
            }
            log.warn("Tool " + tool + " failed: " + message);
            throw new HubException(ErrorCode.ADAPTER_FAILURE, message, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new HubException(ErrorCode.ADAPTER_FAILURE, "Interrupted while waiting for tool " + tool, e);
        }
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "tool-adapter-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
