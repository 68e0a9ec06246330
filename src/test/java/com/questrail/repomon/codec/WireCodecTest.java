package com.questrail.repomon.codec;

import com.questrail.repomon.codec.impl.BinaryMessageDecoder;
import com.questrail.repomon.codec.impl.BinaryMessageEncoder;
import com.questrail.repomon.model.Message;
import com.questrail.repomon.model.MessageCategory;
import com.questrail.repomon.observability.CodecFailureEvent;
import com.questrail.repomon.observability.RecordingObservabilitySink;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class WireCodecTest
{
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    private WireCodec codec(DecodeFailurePolicy policy)
    {
        return new WireCodec(new BinaryMessageEncoder(), new BinaryMessageDecoder(), policy, sink, () -> Instant.EPOCH);
    }

    @Test
    void malformedFrameIsDroppedAndReported()
    {
        WireCodec codec = codec(DecodeFailurePolicy.DROP);

        Optional<Message> result = codec.decode("hello\n".getBytes(StandardCharsets.UTF_8));

        assertTrue(result.isEmpty());
        List<CodecFailureEvent> failures = sink.eventsOfType(CodecFailureEvent.class);
        assertEquals(1, failures.size());
        assertEquals(CodecFailureEvent.Direction.INBOUND, failures.get(0).direction());
        assertInstanceOf(MessageDecodeException.class, failures.get(0).cause());
        assertEquals(Instant.EPOCH, failures.get(0).timestamp());
    }

    @Test
    void malformedFrameBecomesPlaceholderWhenConfigured()
    {
        WireCodec codec = codec(DecodeFailurePolicy.SUBSTITUTE_PLACEHOLDER);

        Optional<Message> result = codec.decode(new byte[] { 1, 2, 3 });

        assertEquals(Optional.of(Message.placeholder()), result);
        assertEquals(1, sink.eventsOfType(CodecFailureEvent.class).size());
    }

    @Test
    void emptyReadIsNotAFailure()
    {
        WireCodec codec = codec(DecodeFailurePolicy.SUBSTITUTE_PLACEHOLDER);

        assertTrue(codec.decode(new byte[0]).isEmpty());
        assertTrue(sink.getAllEvents().isEmpty());
    }

    @Test
    void validFrameDecodes()
    {
        WireCodec codec = codec(DecodeFailurePolicy.DROP);
        Message message = new Message(MessageCategory.UP_TO_DATE, "origin/main");

        assertEquals(Optional.of(message), codec.decode(codec.encode(message)));
        assertTrue(sink.getAllEvents().isEmpty());
    }

    @Test
    void encodeFailureYieldsEmptyFrameAndIsReported()
    {
        WireCodec codec = codec(DecodeFailurePolicy.DROP);

        byte[] frame = codec.encode(Message.info("\uDC00"));

        assertEquals(0, frame.length);
        List<CodecFailureEvent> failures = sink.eventsOfType(CodecFailureEvent.class);
        assertEquals(1, failures.size());
        assertEquals(CodecFailureEvent.Direction.OUTBOUND, failures.get(0).direction());
        assertTrue(failures.get(0).message().contains("INFO"));
    }
}
