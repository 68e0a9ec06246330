package com.questrail.repomon.transport;

import com.questrail.repomon.endpoint.Endpoint;
import com.questrail.repomon.error.BridgeErrorKind;
import com.questrail.repomon.input.MessageHandoff;
import com.questrail.repomon.model.Message;
import com.questrail.repomon.model.MessageCategory;
import com.questrail.repomon.observability.CodecFailureEvent;
import com.questrail.repomon.observability.RecordingObservabilitySink;
import com.questrail.repomon.observability.TransportObservabilityEvent;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.BindException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Instant;
import java.util.List;

import static com.questrail.repomon.transport.TransportTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * DatagramTransportTest
 * -----------------------------------------------------------------------------
 * Sender filtering, one datagram per message, and failure classification for
 * {@link DatagramTransport}.
 */
final class DatagramTransportTest {

    private final Endpoint remote = Endpoint.parse("127.0.0.1:9000");
    private final SocketAddress stranger = new InetSocketAddress("127.0.0.1", 9001);

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final FakeDatagramEndpoint endpoint = new FakeDatagramEndpoint();
    private final MessageHandoff handoff = new MessageHandoff();
    private final RecordingInboundListener inbound = new RecordingInboundListener();

    private final DatagramTransport transport =
        new DatagramTransport(remote, endpoint, codec(sink), sink, () -> Instant.EPOCH);

    @Test
    void bindReportsLocalAddress() {
        transport.open(handoff, inbound);

        assertEquals(new InetSocketAddress("127.0.0.1", 40_000), transport.boundAddress());
        assertEquals(List.of(TransportObservabilityEvent.Type.BOUND), sink.transportEventTypes());
    }

    @Test
    void datagramsFromOtherSendersAreIgnoredBeforeDecoding() {
        transport.open(handoff, inbound);

        endpoint.injectDatagram(stranger, frame(Message.info("spoofed")));
        endpoint.injectDatagram(stranger, new byte[] { 1, 2, 3 });
        endpoint.injectDatagram(remote.address(), frame(new Message(MessageCategory.BEHIND, "2")));

        assertEquals(List.of(new Message(MessageCategory.BEHIND, "2")), inbound.messages());
        assertFalse(sink.hasEventOfType(CodecFailureEvent.class));
    }

    @Test
    void malformedDatagramFromPeerIsDropped() {
        transport.open(handoff, inbound);

        endpoint.injectDatagram(remote.address(), new byte[] { 1, 2, 3 });
        endpoint.injectDatagram(remote.address(), new byte[0]);

        assertTrue(inbound.messages().isEmpty());
        assertEquals(1, sink.eventsOfType(CodecFailureEvent.class).size());
        assertFalse(inbound.hasEnded());
    }

    @Test
    void eachMessageIsOneDatagramToRemote() throws Exception {
        transport.open(handoff, inbound);
        produce(handoff, List.of(Message.info("a"), Message.info("b")));

        List<FakeDatagramEndpoint.Sent> sent = endpoint.awaitSent(2, 1000);

        assertEquals(remote.address(), sent.get(0).remote());
        assertEquals(remote.address(), sent.get(1).remote());
        assertEquals(Message.info("a"), decode(sent.get(0).payload()));
        assertEquals(Message.info("b"), decode(sent.get(1).payload()));
    }

    @Test
    void unencodableMessageSendsNothing() throws Exception {
        transport.open(handoff, inbound);
        produce(handoff, List.of(Message.info("\uD800"), Message.info("ok")));

        assertTrue(await(() -> sink.transportEventTypes().contains(TransportObservabilityEvent.Type.OUTBOUND_DRAINED), 1000));

        List<FakeDatagramEndpoint.Sent> sent = endpoint.sent();
        assertEquals(1, sent.size());
        assertEquals(Message.info("ok"), decode(sent.get(0).payload()));
        assertEquals(CodecFailureEvent.Direction.OUTBOUND,
            sink.eventsOfType(CodecFailureEvent.class).get(0).direction());
    }

    @Test
    void bindFailureIsBindError() throws Exception {
        endpoint.failBindWith(new BindException("Address already in use"));

        transport.open(handoff, inbound);

        assertTrue(inbound.awaitEnd(1000));
        assertEquals(BridgeErrorKind.BIND, inbound.failure().kind());
        assertNull(transport.boundAddress());
    }

    @Test
    void socketFailureAfterBindIsReadError() throws Exception {
        transport.open(handoff, inbound);
        endpoint.injectSocketFailure(new IOException("ICMP port unreachable"));

        assertTrue(inbound.awaitEnd(1000));
        assertEquals(BridgeErrorKind.READ, inbound.failure().kind());
        assertEquals(1, endpoint.stopCalls());
    }

    @Test
    void sendFailureIsWriteError() throws Exception {
        endpoint.failSendsWith(new IOException("Network is unreachable"));

        transport.open(handoff, inbound);
        produce(handoff, List.of(Message.info("x")));

        assertTrue(inbound.awaitEnd(1000));
        assertEquals(BridgeErrorKind.WRITE, inbound.failure().kind());
        assertEquals(1, inbound.endCalls());
    }

    @Test
    void closeEndsCleanlyOnce() throws Exception {
        transport.open(handoff, inbound);

        transport.close();
        transport.close();

        assertTrue(inbound.awaitEnd(1000));
        assertNull(inbound.failure());
        assertEquals(1, inbound.endCalls());

        endpoint.injectDatagram(remote.address(), frame(Message.info("late")));
        assertTrue(inbound.messages().isEmpty());
    }
}
