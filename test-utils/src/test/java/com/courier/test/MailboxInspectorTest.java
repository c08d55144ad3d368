package com.courier.test;

import com.courier.config.DefaultMailboxProvider;
import com.courier.config.MailboxConfig;
import com.courier.mailbox.CoordinatedMailbox;
import com.courier.mailbox.MailboxState;
import com.courier.storage.ArrayDequeStorage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MailboxInspectorTest {

    private static final Duration WAIT = Duration.ofSeconds(2);

    @Test
    @Timeout(5)
    void shouldFollowLifecycleThroughDraining() throws Exception {
        CoordinatedMailbox<String> mailbox = new CoordinatedMailbox<>(new ArrayDequeStorage<>());
        MailboxInspector inspector = MailboxInspector.of(mailbox);
        assertEquals(MailboxState.OPEN, inspector.state());
        assertFalse(inspector.isClosing());

        mailbox.send("a");
        mailbox.send("b");
        mailbox.close();
        assertTrue(inspector.awaitState(MailboxState.DRAINING, WAIT));
        assertTrue(inspector.isClosing());
        assertEquals(2, inspector.size());

        mailbox.receive();
        mailbox.receive();
        assertTrue(inspector.awaitState(MailboxState.CLOSED, WAIT));
        assertTrue(inspector.awaitEmpty(WAIT));
    }

    @Test
    @Timeout(5)
    void shouldTimeOutWhenStateIsNotReached() throws Exception {
        CoordinatedMailbox<String> mailbox = new CoordinatedMailbox<>(new ArrayDequeStorage<>());
        try {
            MailboxInspector inspector = MailboxInspector.of(mailbox);
            assertFalse(inspector.awaitState(MailboxState.CLOSED, Duration.ofMillis(50)));
        } finally {
            mailbox.close();
        }
    }

    @Test
    @Timeout(5)
    void shouldSnapshotMeteredStorage() throws Exception {
        CoordinatedMailbox<Integer> mailbox = new DefaultMailboxProvider<Integer>()
                .createMailbox(new MailboxConfig().setMetered(true));
        try {
            MailboxInspector inspector = MailboxInspector.of(mailbox);
            for (int i = 0; i < 5; i++) {
                mailbox.send(i);
            }
            assertTrue(inspector.awaitSizeBelow(6, WAIT));
            AsyncAssertion.eventually(() -> inspector.size() == 5, WAIT);

            MailboxInspector.MailboxSnapshot snapshot = inspector.snapshot();
            assertEquals(MailboxState.OPEN, snapshot.state());
            assertEquals(5, snapshot.size());
            assertNotNull(snapshot.storageMetrics());
            assertEquals(5, snapshot.storageMetrics().totalAppended());
        } finally {
            mailbox.close();
        }
    }

    @Test
    void shouldReportNoMetricsForUnmeteredStorage() {
        CoordinatedMailbox<String> mailbox = new CoordinatedMailbox<>(new ArrayDequeStorage<>());
        try {
            assertTrue(MailboxInspector.of(mailbox).storageMetrics().isEmpty());
            assertNull(MailboxInspector.of(mailbox).snapshot().storageMetrics());
        } finally {
            mailbox.close();
        }
    }
}
