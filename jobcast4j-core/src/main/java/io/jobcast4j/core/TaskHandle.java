package io.jobcast4j.core;

/**
 * Handle into the timer runner for one job.
 */
public interface TaskHandle {

    /**
     * Request immediate execution.
     *
     * @param onAccepted invoked before the run is submitted, only if the request was accepted
     * @return false if the task is retired or already executing
     */
    boolean runNow(Runnable onAccepted);

    /**
     * Stop future timer fires. An execution already in flight is left to complete.
     */
    void retire();

    boolean isExecuting();
}
