/**
 * Read-side access to jobs and job logs.
 */
package netimport.query;
