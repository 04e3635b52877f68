package netimport.dispatch;

import netimport.model.Job;

/**
 * What {@link JobDispatcher#submit} returns.
 *
 * @param job           terminal job for {@link ExecutionMode#IMMEDIATE}, queued job otherwise
 * @param executionMode how the job was executed
 * @param reason        probe explanation for the choice
 * @param workerCount   live workers seen by the probe
 */
public record JobHandle(Job job, ExecutionMode executionMode, String reason, int workerCount) {
}
