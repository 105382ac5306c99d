package com.demo.coordination.infrastructure;

import java.util.NoSuchElementException;

/**
 * Whole answer of a blocking call as a single increment. The call is made on
 * the first {@link #hasNext()} so closing the stream can interrupt it.
 */
class SyncCompletionStream extends AbortableHttpStream {

    private final String operation;
    private final Exchange<String> call;

    private String answer;
    private boolean consumed;

    SyncCompletionStream(String operation, Exchange<String> call) {
        this.operation = operation;
        this.call = call;
    }

    @Override
    public boolean hasNext() {
        if (consumed || isClosed()) {
            return false;
        }
        if (answer == null) {
            try {
                answer = await(operation, call);
            } catch (RuntimeException e) {
                consumed = true;
                throw e;
            }
        }
        return true;
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        consumed = true;
        return answer;
    }
}
