package netimport.spi;

import java.time.Instant;

/**
 * A queued job reference handed to a worker by {@link WorkerTransport#claim}.
 *
 * @param taskRef    transport-level id, passed back to {@link WorkerTransport#acknowledge}
 * @param jobId      the job to run
 * @param enqueuedAt when the task was enqueued
 * @param deliveries how many times the task has been claimed, including this one
 */
public record ClaimedTask(String taskRef, String jobId, Instant enqueuedAt, int deliveries) {
}
