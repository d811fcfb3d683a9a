package trialdb.jdbc.tx;

/**
 * A unit of work that takes one argument in addition to the session.
 *
 * @param <A> argument type
 * @param <R> result type
 * @see ScopedSessions#scopedFunction(String, SessionFunction)
 */
@FunctionalInterface
public interface SessionFunction<A, R> {
  R apply(Session session, A argument) throws Exception;
}
