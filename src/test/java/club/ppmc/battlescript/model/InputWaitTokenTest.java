/**
 * InputWaitTokenTest.java
 */
package club.ppmc.battlescript.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class InputWaitTokenTest {

    @Test
    void resumesExactlyOnce() throws Exception {
        var token = new InputWaitToken();
        assertFalse(token.isResumed());

        assertTrue(token.resume("first"));
        assertFalse(token.resume("second"));
        assertFalse(token.release());

        assertTrue(token.isResumed());
        assertEquals("first", token.await());
    }

    @Test
    void releaseResumesWithNull() throws Exception {
        var token = new InputWaitToken();
        assertTrue(token.release());
        assertNull(token.await());
    }

    @Test
    void awaitBlocksUntilResumedFromAnotherThread() throws Exception {
        var token = new InputWaitToken();
        CompletableFuture<String> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return token.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return "interrupted";
            }
        });
        Thread.sleep(50);
        assertFalse(waiter.isDone());

        token.resume("line");
        assertEquals("line", waiter.get(5, TimeUnit.SECONDS));
    }
}
