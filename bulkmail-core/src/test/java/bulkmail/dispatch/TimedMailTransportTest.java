package bulkmail.dispatch;

import bulkmail.DeliveryResult;
import bulkmail.OutgoingMail;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimedMailTransportTest {
    private static final OutgoingMail MAIL = new OutgoingMail("a@example.com", "Subject", "Body");

    @Test
    void returnsDelegateResult() throws Exception {
        try (TimedMailTransport transport = new TimedMailTransport(mail -> DeliveryResult.sent(), 1, 1000, "t-")) {
            assertInstanceOf(DeliveryResult.Sent.class, transport.send(MAIL));
            assertEquals(1, transport.availableSlots());
        }
    }

    @Test
    void rethrowsDelegateException() {
        try (TimedMailTransport transport = new TimedMailTransport(mail -> {
            throw new IOException("connection refused");
        }, 1, 1000, "t-")) {
            IOException e = assertThrows(IOException.class, () -> transport.send(MAIL));
            assertEquals("connection refused", e.getMessage());
        }
    }

    @Test
    void slowCallTimesOutAndIsInterrupted() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        try (TimedMailTransport transport = new TimedMailTransport(mail -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return DeliveryResult.sent();
        }, 1, 100, "t-")) {
            TimeoutException e = assertThrows(TimeoutException.class, () -> transport.send(MAIL));

            assertEquals("Timed out after 100 ms", e.getMessage());
            assertTrue(interrupted.await(2, TimeUnit.SECONDS));
        }
    }

    @Test
    void callThatIgnoresInterruptHoldsItsSlot() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        try (TimedMailTransport transport = new TimedMailTransport(mail -> {
            while (true) {
                try {
                    if (release.await(10, TimeUnit.SECONDS)) {
                        return DeliveryResult.sent();
                    }
                } catch (InterruptedException e) {
                    // keeps waiting
                }
            }
        }, 1, 50, "t-")) {
            assertThrows(TimeoutException.class, () -> transport.send(MAIL));
            assertEquals(0, transport.availableSlots());

            TimeoutException saturated = assertThrows(TimeoutException.class, () -> transport.send(MAIL));
            assertTrue(saturated.getMessage().startsWith("Transport saturated"));
        } finally {
            release.countDown();
        }
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class,
                () -> new TimedMailTransport(mail -> DeliveryResult.sent(), 0, 100, "t-"));
        assertThrows(IllegalArgumentException.class,
                () -> new TimedMailTransport(mail -> DeliveryResult.sent(), 1, 0, "t-"));
        assertThrows(NullPointerException.class,
                () -> new TimedMailTransport(null, 1, 100, "t-"));
    }
}
