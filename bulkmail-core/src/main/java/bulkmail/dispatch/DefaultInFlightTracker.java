package bulkmail.dispatch;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Set-backed in-flight tracker.
 *
 * <p>A delivery key stays held from submission until its worker releases it after the
 * attempt, however long the transport takes. Keys never expire: handing a key to a second
 * worker while the first attempt is still running would let both pass the delivery log
 * check and send twice.
 *
 * <p>This class is thread-safe.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
  private final Set<String> held = ConcurrentHashMap.newKeySet();

  @Override
  public boolean tryAcquire(String key) {
    return held.add(key);
  }

  @Override
  public void release(String key) {
    held.remove(key);
  }

  @Override
  public int size() {
    return held.size();
  }
}
