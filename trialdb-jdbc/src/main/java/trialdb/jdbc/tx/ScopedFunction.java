package trialdb.jdbc.tx;

/**
 * A function whose every invocation runs inside its own scoped session.
 *
 * @param <A> argument type
 * @param <R> result type
 * @see ScopedSessions#scopedFunction(String, SessionFunction)
 */
@FunctionalInterface
public interface ScopedFunction<A, R> {
  R apply(A argument) throws Exception;
}
