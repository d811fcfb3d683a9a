package trialdb.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Thread-safe record of the most recent entries, oldest first. Once {@code capacity}
 * entries are held, each new entry evicts the oldest.
 */
public final class RecentHistory<T> {
  /** Default number of entries kept. */
  public static final int DEFAULT_CAPACITY = 100;

  private final int capacity;
  private final Deque<T> entries = new ArrayDeque<>();

  public RecentHistory() {
    this(DEFAULT_CAPACITY);
  }

  public RecentHistory(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be >= 1");
    }
    this.capacity = capacity;
  }

  public synchronized void add(T entry) {
    if (entries.size() == capacity) {
      entries.removeFirst();
    }
    entries.addLast(entry);
  }

  public synchronized List<T> snapshot() {
    return List.copyOf(entries);
  }

  public int capacity() {
    return capacity;
  }
}
