/**
 * Submission of import jobs and the choice between inline and queued execution.
 *
 * <h2>Decision</h2>
 * <p>Every {@link netimport.dispatch.JobDispatcher#submit submission} probes the
 * {@link netimport.dispatch.ExecutionBackendDetector} afresh. There is no cached view of
 * worker availability: a worker pool that appears or disappears between two requests is
 * reflected in the second one.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * JobDispatcher dispatcher = JobDispatcher.builder()
 *     .connectionProvider(connProvider)
 *     .jobStore(store)
 *     .runner(runner)
 *     .transport(transport)
 *     .detector(new WorkerPoolDetector(transport, Duration.ofSeconds(2)))
 *     .build();
 *
 * JobHandle handle = dispatcher.submit(
 *     new JobRequest("lab01", "check", JobSettings.of("lab", "lab-creds")), "alice");
 * }</pre>
 */
package netimport.dispatch;
