package trialdb.jdbc.tx;

/**
 * A unit of work executed against a session.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface SessionWork<T> {
  T execute(Session session) throws Exception;
}
