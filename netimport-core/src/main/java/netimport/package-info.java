/**
 * Network configuration import jobs.
 *
 * <p>{@link netimport.NetImport} is the usual entry point. Submissions go through the
 * {@link netimport.dispatch.JobDispatcher}, which either runs a job inline or hands it to
 * a {@link netimport.worker.JobWorker}; both paths execute it with the same
 * {@link netimport.runner.JobRunner}. Progress is persisted as an ordered log per job and
 * read back through {@link netimport.query.JobQueries}.
 *
 * <p>The exceptions in this package are unchecked and form the error vocabulary of the
 * library.
 */
package netimport;
