package com.demo.coordination.infrastructure;

import com.demo.coordination.exception.ProviderFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.io.InputStream;

/**
 * Completion stream over one HTTP exchange, started on the first read.
 *
 * Every blocking step runs through {@link #await}. {@link #close()} may come
 * from another thread: it interrupts the waiting reader and closes the
 * response body without reading the rest, so an upstream that is slow or
 * silent never holds up a cancelled run.
 */
@Slf4j
abstract class AbortableHttpStream implements CompletionStream {

    @FunctionalInterface
    interface Exchange<T> {
        T run() throws IOException;
    }

    private final Object waitLock = new Object();

    // guarded by waitLock
    private Thread waiter;
    private boolean interruptSent;

    private volatile boolean closed;
    private volatile InputStream body;

    protected boolean isClosed() {
        return closed;
    }

    /**
     * Runs one blocking step of the exchange on the calling thread.
     *
     * @throws ProviderFailureException if the step fails, or if the stream was
     *         closed before or while it ran
     */
    protected final <T> T await(String operation, Exchange<T> exchange) {
        synchronized (waitLock) {
            if (closed) {
                throw new ProviderFailureException(operation + " aborted");
            }
            waiter = Thread.currentThread();
        }
        try {
            return exchange.run();
        } catch (IOException | RestClientException e) {
            if (closed) {
                throw new ProviderFailureException(operation + " aborted", e);
            }
            throw new ProviderFailureException(operation + " failed: " + e.getMessage(), e);
        } finally {
            synchronized (waitLock) {
                waiter = null;
                if (interruptSent) {
                    // Aimed at the exchange, not at the pooled thread running it
                    Thread.interrupted();
                    interruptSent = false;
                }
            }
        }
    }

    /**
     * Registers the response body so {@link #close()} can cut a read short.
     */
    protected final InputStream track(InputStream responseBody) throws IOException {
        this.body = responseBody;
        if (closed) {
            responseBody.close();
            throw new IOException("Stream closed while opening");
        }
        return responseBody;
    }

    @Override
    public void close() {
        synchronized (waitLock) {
            if (closed) {
                return;
            }
            closed = true;
            if (waiter != null) {
                waiter.interrupt();
                interruptSent = true;
            }
        }
        InputStream current = body;
        if (current != null) {
            try {
                current.close();
            } catch (IOException e) {
                log.debug("Completion body close failed: {}", e.getMessage());
            }
        }
    }
}
