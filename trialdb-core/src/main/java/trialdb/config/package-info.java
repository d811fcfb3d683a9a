/**
 * Configuration bundle read by the JDBC and notification modules.
 */
package trialdb.config;
