/**
 * The worker process side of queued execution.
 *
 * @see netimport.worker.JobWorker
 */
package netimport.worker;
