/**
 * Age-based deletion of finished jobs for each supported database.
 *
 * @see netimport.purge.JobPurgeScheduler
 */
package netimport.jdbc.purge;
