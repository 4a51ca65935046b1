package io.jobcast4j.core.event;

/**
 * Output-channel event carrying the job's new running flag.
 */
public interface RunningStateChange extends StatusEvent {
    boolean running();

    @Override
    default StatusChannel channel() {
        return StatusChannel.OUTPUT;
    }
}
