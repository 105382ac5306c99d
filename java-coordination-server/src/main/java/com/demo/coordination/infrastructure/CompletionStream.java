package com.demo.coordination.infrastructure;

import java.util.Iterator;

/**
 * Text increments of one generation. Closing it releases the underlying
 * connection and may be called from another thread to abort a blocked read.
 */
public interface CompletionStream extends Iterator<String>, AutoCloseable {

    @Override
    void close();
}
