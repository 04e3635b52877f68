/**
 * Database-backed {@link netimport.spi.WorkerTransport}: a task queue table claimed with
 * row locks and a worker registry table refreshed by heartbeats.
 */
package netimport.jdbc.transport;
