/**
 * Job execution: the {@link netimport.runner.JobRunner} and the per-job
 * {@link netimport.runner.JobLogSink}.
 */
package netimport.runner;
