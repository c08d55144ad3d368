package com.courier.test;

import com.courier.mailbox.CoordinatedMailbox;
import com.courier.mailbox.MailboxException;
import com.courier.storage.ArrayDequeStorage;
import com.courier.storage.Storage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessageCaptureTest {

    private static final Duration WAIT = Duration.ofSeconds(2);

    @Test
    @Timeout(5)
    void shouldCaptureMessagesInOrderUntilEndOfStream() throws Exception {
        CoordinatedMailbox<String> mailbox = new CoordinatedMailbox<>(new ArrayDequeStorage<>());
        MessageCapture<String> capture = MessageCapture.drain(mailbox);

        mailbox.send("msg1");
        mailbox.send("msg2");
        mailbox.send("msg3");
        mailbox.close();

        assertTrue(capture.awaitEndOfStream(WAIT));
        assertEquals(List.of("msg1", "msg2", "msg3"), capture.all());
        assertEquals("msg2", capture.get(1));
        assertTrue(capture.contains("msg3"::equals));
        assertEquals(List.of("msg1"), capture.filter(m -> m.endsWith("1")));
        assertNull(capture.failure());
    }

    @Test
    @Timeout(5)
    void shouldAwaitCount() throws Exception {
        CoordinatedMailbox<Integer> mailbox = new CoordinatedMailbox<>(new ArrayDequeStorage<>());
        MessageCapture<Integer> capture = MessageCapture.drain(mailbox);
        try {
            for (int i = 0; i < 100; i++) {
                mailbox.send(i);
            }
            assertTrue(capture.awaitCount(100, WAIT));
            assertFalse(capture.isEndOfStream());
        } finally {
            mailbox.close();
        }
        assertTrue(capture.awaitEndOfStream(WAIT));
        assertEquals(100, capture.size());
    }

    @Test
    @Timeout(5)
    void shouldStopWithoutLosingMessages() throws Exception {
        CoordinatedMailbox<String> mailbox = new CoordinatedMailbox<>(new ArrayDequeStorage<>());
        MessageCapture<String> capture = MessageCapture.drain(mailbox);
        try {
            capture.stop();
            assertFalse(capture.awaitEndOfStream(WAIT));
            assertTrue(capture.isEmpty());

            // The withdrawn receive must not have claimed this message
            mailbox.send("kept");
            assertEquals("kept", mailbox.receive().message());
        } finally {
            mailbox.close();
        }
    }

    @Test
    @Timeout(5)
    void shouldRecordMailboxFailure() throws Exception {
        Storage<String> failing = new ArrayDequeStorage<>() {
            @Override
            public String peek() {
                throw new IllegalStateException("broken");
            }
        };
        CoordinatedMailbox<String> mailbox = new CoordinatedMailbox<>(failing);
        MessageCapture<String> capture = MessageCapture.drain(mailbox);

        mailbox.send("a");

        assertFalse(capture.awaitEndOfStream(WAIT));
        assertInstanceOf(MailboxException.class, capture.failure());
        assertTrue(capture.isEmpty());
    }
}
