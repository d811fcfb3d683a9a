/**
 * Small shared utilities.
 */
package trialdb.util;
