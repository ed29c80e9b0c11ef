package bulkmail.dispatch;

/**
 * Tracks delivery keys currently queued or running in this process.
 */
public interface InFlightTracker {
  boolean tryAcquire(String key);

  void release(String key);

  int size();
}
