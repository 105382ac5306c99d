package com.demo.coordination.service;

import com.demo.coordination.domain.RunRequest;

/**
 * Starts a background run for a responder that already holds the thread lock.
 */
public interface RunLauncher {

    /**
     * Creates the run record and schedules generation.
     *
     * @return the new run id
     */
    String launch(RunRequest request);
}
