/**
 * Backoff policies shared by the serializable retry driver and the outbox publisher.
 */
package trialdb.retry;
