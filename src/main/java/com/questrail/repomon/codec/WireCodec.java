package com.questrail.repomon.codec;

import com.questrail.repomon.internal.time.WallClock;
import com.questrail.repomon.model.Message;
import com.questrail.repomon.observability.BridgeObservabilitySink;
import com.questrail.repomon.observability.CodecFailureEvent;

import java.util.Objects;
import java.util.Optional;

/**
 * WireCodec
 * =============================================================================
 * Failure policy wrapped around a {@link MessageEncoder} / {@link MessageDecoder}
 * pair. Both transports go through this class and never call the raw codec.
 *
 * <h2>Outbound</h2>
 * {@link #encode(Message)} never throws. An encode failure is reported to the
 * observability sink and yields a zero-length frame, which transports treat
 * as "nothing to write".
 *
 * <h2>Inbound</h2>
 * {@link #decode(byte[])} never throws. An empty buffer yields no message and
 * is not a failure. A malformed buffer is reported and then handled according
 * to the configured {@link DecodeFailurePolicy}.
 */
public final class WireCodec
{
    private static final byte[] NO_FRAME = new byte[0];

    private final MessageEncoder encoder;
    private final MessageDecoder decoder;
    private final DecodeFailurePolicy decodeFailurePolicy;
    private final BridgeObservabilitySink sink;
    private final WallClock clock;

    public WireCodec(MessageEncoder encoder,
                     MessageDecoder decoder,
                     DecodeFailurePolicy decodeFailurePolicy,
                     BridgeObservabilitySink sink,
                     WallClock clock)
    {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.decodeFailurePolicy = Objects.requireNonNull(decodeFailurePolicy, "decodeFailurePolicy");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Encode a message, returning an empty array if it cannot be encoded.
     */
    public byte[] encode(Message message)
    {
        Objects.requireNonNull(message, "message");
        try {
            return encoder.encode(message);
        }
        catch (MessageEncodeException e) {
            sink.onCodecFailure(new CodecFailureEvent(
                    clock.now(),
                    CodecFailureEvent.Direction.OUTBOUND,
                    "Dropping " + message.category() + " message: " + e.getMessage(),
                    e));
            return NO_FRAME;
        }
    }

    /**
     * Decode one transport read.
     */
    public Optional<Message> decode(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");
        try {
            return decoder.decode(frame);
        }
        catch (MessageDecodeException e) {
            sink.onCodecFailure(new CodecFailureEvent(
                    clock.now(),
                    CodecFailureEvent.Direction.INBOUND,
                    e.getMessage(),
                    e));
            return decodeFailurePolicy == DecodeFailurePolicy.SUBSTITUTE_PLACEHOLDER
                    ? Optional.of(Message.placeholder())
                    : Optional.empty();
        }
    }
}
