package com.questrail.repomon.config;

import com.questrail.repomon.codec.DecodeFailurePolicy;
import com.questrail.repomon.codec.impl.BinaryWireFormat;
import com.questrail.repomon.endpoint.Endpoint;
import com.questrail.repomon.input.InputBridge;
import com.questrail.repomon.input.InputMode;
import com.questrail.repomon.transport.TransportKind;

import java.util.Objects;

/**
 * Aggregated configuration for one bridge session.
 *
 * <p>Only {@link #transport()} and {@link #remote()} select protocol behavior;
 * the remaining fields tune the input and codec policies.</p>
 */
public record BridgeConfig(
    Endpoint remote,
    TransportKind transport,
    InputMode inputMode,
    DecodeFailurePolicy decodeFailurePolicy,
    int chunkSize,
    int maxFrameLength
) {
    public BridgeConfig {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(inputMode, "inputMode");
        Objects.requireNonNull(decodeFailurePolicy, "decodeFailurePolicy");
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (maxFrameLength < BinaryWireFormat.HEADER_LENGTH) {
            throw new IllegalArgumentException(
                "maxFrameLength must be at least the " + BinaryWireFormat.HEADER_LENGTH + "-byte frame header");
        }
    }

    public static BridgeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Endpoint remote;
        private TransportKind transport = TransportKind.STREAM;
        private InputMode inputMode = InputMode.TEXT;
        private DecodeFailurePolicy decodeFailurePolicy = DecodeFailurePolicy.DROP;
        private int chunkSize = InputBridge.DEFAULT_CHUNK_SIZE;
        private int maxFrameLength = BinaryWireFormat.DEFAULT_MAX_FRAME_LENGTH;

        public Builder withRemote(Endpoint remote) {
            this.remote = remote;
            return this;
        }

        /**
         * Parses {@code ip:port}; throws {@code BridgeException} on a malformed address.
         */
        public Builder withRemote(String remote) {
            this.remote = Endpoint.parse(remote);
            return this;
        }

        public Builder withTransport(TransportKind transport) {
            this.transport = transport;
            return this;
        }

        public Builder withDatagram(boolean datagram) {
            this.transport = datagram ? TransportKind.DATAGRAM : TransportKind.STREAM;
            return this;
        }

        public Builder withInputMode(InputMode inputMode) {
            this.inputMode = inputMode;
            return this;
        }

        public Builder withDecodeFailurePolicy(DecodeFailurePolicy policy) {
            this.decodeFailurePolicy = policy;
            return this;
        }

        public Builder withChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder withMaxFrameLength(int maxFrameLength) {
            this.maxFrameLength = maxFrameLength;
            return this;
        }

        public BridgeConfig build() {
            Endpoint effectiveRemote = remote != null ? remote : Endpoint.defaultEndpoint();
            return new BridgeConfig(effectiveRemote, transport, inputMode, decodeFailurePolicy,
                chunkSize, maxFrameLength);
        }
    }
}
