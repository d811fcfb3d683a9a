/**
 * Value types shared by the session implementations.
 *
 * @see trialdb.model.SessionState
 */
package trialdb.model;
