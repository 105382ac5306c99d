package com.demo.coordination.infrastructure;

import com.demo.coordination.domain.CompletionRequest;

/**
 * External generative-response provider.
 */
public interface CompletionSource {

    /**
     * Starts one generation. The returned stream is lazy, finite and can be
     * consumed once; both this call and the stream may throw
     * {@link com.demo.coordination.exception.ProviderFailureException}.
     */
    CompletionStream generate(CompletionRequest request);
}
