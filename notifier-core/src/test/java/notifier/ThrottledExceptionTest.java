package notifier;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ThrottledExceptionTest {

    @Test
    void ofSecondsConvertsWholeSeconds() {
        ThrottledException ex = ThrottledException.ofSeconds(3);

        assertEquals(Duration.ofSeconds(3), ex.retryAfter());
        assertEquals(3000, ex.retryAfter().toMillis());
        assertEquals("Throttled, retry after 3s", ex.getMessage());
    }

    @Test
    void keepsCause() {
        IOException cause = new IOException("429 Too Many Requests");
        ThrottledException ex = new ThrottledException(Duration.ofSeconds(7), cause);

        assertSame(cause, ex.getCause());
        assertEquals(Duration.ofSeconds(7), ex.retryAfter());
    }

    @Test
    void zeroDelayIsAllowed() {
        assertEquals(Duration.ZERO, new ThrottledException(Duration.ZERO).retryAfter());
    }

    @Test
    void rejectsNullDelay() {
        assertThrows(NullPointerException.class, () -> new ThrottledException(null));
    }

    @Test
    void rejectsNegativeDelay() {
        assertThrows(IllegalArgumentException.class, () -> ThrottledException.ofSeconds(-1));
        assertThrows(IllegalArgumentException.class,
                () -> new ThrottledException(Duration.ofMillis(-5), new RuntimeException()));
    }
}
