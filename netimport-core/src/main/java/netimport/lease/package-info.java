/**
 * Heartbeat lease for RUNNING jobs.
 *
 * <p>Runners refresh {@code heartbeat_at} while they work; the
 * {@link netimport.lease.OrphanedJobReaper} fails jobs whose lease ran out.
 */
package netimport.lease;
