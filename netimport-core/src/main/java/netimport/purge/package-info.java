/**
 * Scheduled deletion of old finished jobs.
 */
package netimport.purge;
