package com.questrail.repomon.transport;

import com.questrail.repomon.endpoint.Endpoint;
import com.questrail.repomon.error.BridgeErrorKind;
import com.questrail.repomon.input.InputBridge;
import com.questrail.repomon.input.InputMessageFactory;
import com.questrail.repomon.input.InputMode;
import com.questrail.repomon.input.MessageHandoff;
import com.questrail.repomon.model.Message;
import com.questrail.repomon.model.MessageCategory;
import com.questrail.repomon.observability.CodecFailureEvent;
import com.questrail.repomon.observability.RecordingObservabilitySink;
import com.questrail.repomon.observability.TransportObservabilityEvent;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.questrail.repomon.transport.TransportTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StreamTransportTest
 * -----------------------------------------------------------------------------
 * Drives {@link StreamTransport} through {@link FakeStreamConnection}: the test
 * plays the remote peer, the real codec and forwarder run underneath.
 */
final class StreamTransportTest {

    private final Endpoint remote = Endpoint.parse("127.0.0.1:9000");
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final FakeStreamConnection connection = new FakeStreamConnection();
    private final MessageHandoff handoff = new MessageHandoff();
    private final RecordingInboundListener inbound = new RecordingInboundListener();

    private final StreamTransport transport =
        new StreamTransport(remote, connection, codec(sink), sink, () -> Instant.EPOCH);

    @Test
    void inboundFramesArriveInReceiveOrder() {
        Message f1 = new Message(MessageCategory.AHEAD, "1");
        Message f2 = new Message(MessageCategory.BEHIND, "2");
        Message f3 = new Message(MessageCategory.UP_TO_DATE, "3");

        transport.open(handoff, inbound);
        connection.deliver(frame(f1));
        connection.deliver(frame(f2));
        connection.deliver(frame(f3));

        assertEquals(StreamTransport.State.CONNECTED, transport.state());
        assertEquals(List.of(f1, f2, f3), inbound.messages());
        assertFalse(inbound.hasEnded());
    }

    @Test
    void eachOutboundMessageIsWrittenAsOneFrame() throws Exception {
        transport.open(handoff, inbound);
        produce(handoff, List.of(Message.info("hello\n")));

        List<byte[]> written = connection.awaitWritten(1, 1000);
        assertTrue(await(() -> sink.transportEventTypes().contains(TransportObservabilityEvent.Type.OUTBOUND_DRAINED), 1000));

        assertEquals(1, connection.written().size());
        assertEquals(Message.info("hello\n"), decode(written.get(0)));
    }

    @Test
    void outboundOrderIsPreserved() throws Exception {
        List<Message> messages = List.of(Message.info("a"), Message.info("b"), Message.info("c"));

        transport.open(handoff, inbound);
        produce(handoff, messages);

        List<byte[]> written = connection.awaitWritten(3, 1000);
        assertEquals(messages, List.of(decode(written.get(0)), decode(written.get(1)), decode(written.get(2))));
    }

    @Test
    void peerCloseEndsCleanlyAfterDeliveredFrames() throws Exception {
        transport.open(handoff, inbound);
        connection.deliver(frame(Message.info("one")));
        connection.deliver(frame(Message.info("two")));
        connection.peerClose();

        assertTrue(inbound.awaitEnd(1000));
        assertNull(inbound.failure());
        assertEquals(2, inbound.messages().size());
        assertEquals(StreamTransport.State.CLOSED, transport.state());
        assertTrue(sink.transportEventTypes().contains(TransportObservabilityEvent.Type.CLOSED));
    }

    @Test
    void undecodableReadIsDroppedAndSessionContinues() {
        transport.open(handoff, inbound);
        connection.deliver("hello\n".getBytes(StandardCharsets.UTF_8));
        connection.deliver(frame(Message.info("after")));

        assertEquals(List.of(Message.info("after")), inbound.messages());
        assertEquals(1, sink.eventsOfType(CodecFailureEvent.class).size());
        assertFalse(inbound.hasEnded());
    }

    @Test
    void connectFailureIsConnectionError() throws Exception {
        connection.failConnectWith(new ConnectException("Connection refused"));

        transport.open(handoff, inbound);

        assertTrue(inbound.awaitEnd(1000));
        assertEquals(BridgeErrorKind.CONNECTION, inbound.failure().kind());
        assertInstanceOf(ConnectException.class, inbound.failure().getCause());
        assertTrue(inbound.failure().getMessage().contains("127.0.0.1:9000"));
    }

    @Test
    void readFailureIsReadError() throws Exception {
        transport.open(handoff, inbound);
        connection.failRead(new IOException("Connection reset by peer"));

        assertTrue(inbound.awaitEnd(1000));
        assertEquals(BridgeErrorKind.READ, inbound.failure().kind());
    }

    @Test
    void writeFailureEndsSessionAndClosesConnection() throws Exception {
        connection.failWritesWith(new IOException("Broken pipe"));

        transport.open(handoff, inbound);
        produce(handoff, List.of(Message.info("x")));

        assertTrue(inbound.awaitEnd(1000));
        assertEquals(BridgeErrorKind.WRITE, inbound.failure().kind());
        assertEquals(1, connection.closeCalls());
        assertEquals(1, inbound.endCalls());
    }

    @Test
    void closeIsIdempotentAndEndsOnce() throws Exception {
        transport.open(handoff, inbound);

        transport.close();
        transport.close();

        assertTrue(inbound.awaitEnd(1000));
        assertNull(inbound.failure());
        assertEquals(1, inbound.endCalls());

        connection.deliver(frame(Message.info("late")));
        assertTrue(inbound.messages().isEmpty());
    }

    @Test
    void openTwiceIsRejected() {
        transport.open(handoff, inbound);
        assertThrows(IllegalStateException.class, () -> transport.open(handoff, inbound));
    }

    @Test
    void stalledWriteStopsTheInputReader() throws Exception {
        EndlessInput endless = new EndlessInput();
        InputBridge bridge = new InputBridge(
            endless, handoff, InputMessageFactory.forMode(InputMode.TEXT), 8, sink, () -> Instant.EPOCH);
        connection.holdWrites();

        transport.open(handoff, inbound);
        bridge.start();
        connection.awaitWritten(1, 1000);
        Thread.sleep(200);

        assertEquals(1, connection.written().size());
        assertTrue(endless.reads() <= 2, "reads=" + endless.reads());

        bridge.stop();
        assertTrue(bridge.awaitTermination(1000));
        transport.close();
    }

    /**
     * Input that never ends and counts read calls.
     */
    private static final class EndlessInput extends InputStream {
        private final AtomicInteger reads = new AtomicInteger();

        @Override
        public int read() {
            reads.incrementAndGet();
            return 'x';
        }

        @Override
        public int read(byte[] b, int off, int len) {
            reads.incrementAndGet();
            for (int i = 0; i < len; i++) {
                b[off + i] = 'x';
            }
            return len;
        }

        int reads() {
            return reads.get();
        }
    }
}
