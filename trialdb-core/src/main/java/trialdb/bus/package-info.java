/**
 * Message bus implementations that need no broker.
 */
package trialdb.bus;
