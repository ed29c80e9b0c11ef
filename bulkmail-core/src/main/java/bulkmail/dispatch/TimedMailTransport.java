package bulkmail.dispatch;

import bulkmail.DeliveryResult;
import bulkmail.MailTransport;
import bulkmail.OutgoingMail;
import bulkmail.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Runs a {@link MailTransport} on a fixed set of threads with a per-call timeout.
 *
 * <p>At most {@code maxConcurrent} calls hold a transport thread at any time. A call that
 * times out is interrupted, but a transport that ignores interruption keeps its thread and
 * its slot until it returns. When no slot frees up within the timeout the call fails with a
 * {@link TimeoutException} instead of starting another thread, so stuck transports can
 * never grow the thread count.
 *
 * <p>This class is thread-safe.
 */
public final class TimedMailTransport implements MailTransport, AutoCloseable {
  private static final Logger logger = Logger.getLogger(TimedMailTransport.class.getName());

  private final MailTransport delegate;
  private final long timeoutMs;
  private final Semaphore slots;
  private final ExecutorService executor;

  /**
   * @param delegate      the transport to call
   * @param maxConcurrent number of transport threads; must be &gt; 0
   * @param timeoutMs     per-call timeout in milliseconds; must be &gt; 0
   * @param threadPrefix  name prefix for the transport threads
   */
  public TimedMailTransport(MailTransport delegate, int maxConcurrent, long timeoutMs, String threadPrefix) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    Objects.requireNonNull(threadPrefix, "threadPrefix");
    if (maxConcurrent <= 0) {
      throw new IllegalArgumentException("maxConcurrent must be > 0");
    }
    if (timeoutMs <= 0) {
      throw new IllegalArgumentException("timeoutMs must be > 0");
    }
    this.timeoutMs = timeoutMs;
    this.slots = new Semaphore(maxConcurrent);
    this.executor = Executors.newFixedThreadPool(maxConcurrent, new DaemonThreadFactory(threadPrefix));
  }

  /**
   * Sends through the delegate, waiting at most the timeout for a free thread and again
   * at most the timeout for the result.
   *
   * @throws TimeoutException     if no thread was free in time or the call did not finish
   * @throws InterruptedException if the caller was interrupted; the call is cancelled
   * @throws Exception            whatever the delegate threw
   */
  @Override
  public DeliveryResult send(OutgoingMail mail) throws Exception {
    Objects.requireNonNull(mail, "mail");
    if (!slots.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS)) {
      logger.warning("No free transport thread for mail to " + mail.to() + " within " + timeoutMs + " ms");
      throw new TimeoutException("Transport saturated: no free transport thread within " + timeoutMs + " ms");
    }
    AtomicBoolean started = new AtomicBoolean();
    Future<DeliveryResult> future;
    try {
      future = executor.submit(() -> {
        if (!started.compareAndSet(false, true)) {
          return null;
        }
        try {
          return delegate.send(mail);
        } finally {
          slots.release();
        }
      });
    } catch (RuntimeException e) {
      slots.release();
      throw e;
    }
    try {
      return future.get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      abandon(future, started);
      throw new TimeoutException("Timed out after " + timeoutMs + " ms");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof Exception) {
        throw (Exception) cause;
      }
      throw e;
    } catch (InterruptedException e) {
      abandon(future, started);
      throw e;
    }
  }

  // a call cancelled before it started never reaches its finally block
  private void abandon(Future<DeliveryResult> future, AtomicBoolean started) {
    future.cancel(true);
    if (started.compareAndSet(false, true)) {
      slots.release();
    }
  }

  /** Number of transport threads not held by a running call. */
  public int availableSlots() {
    return slots.availablePermits();
  }

  /** Interrupts running calls and stops the transport threads. */
  @Override
  public void close() {
    executor.shutdownNow();
  }
}
