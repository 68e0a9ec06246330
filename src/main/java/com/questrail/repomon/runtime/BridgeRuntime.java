package com.questrail.repomon.runtime;

import com.questrail.repomon.codec.WireCodec;
import com.questrail.repomon.codec.impl.BinaryMessageDecoder;
import com.questrail.repomon.codec.impl.BinaryMessageEncoder;
import com.questrail.repomon.config.BridgeConfig;
import com.questrail.repomon.driver.ConsoleMessageOutput;
import com.questrail.repomon.driver.ForwardingDriver;
import com.questrail.repomon.driver.MessageOutput;
import com.questrail.repomon.input.InputBridge;
import com.questrail.repomon.input.InputMessageFactory;
import com.questrail.repomon.input.MessageHandoff;
import com.questrail.repomon.internal.time.SystemWallClock;
import com.questrail.repomon.internal.time.WallClock;
import com.questrail.repomon.observability.BridgeObservabilitySink;
import com.questrail.repomon.observability.NullObservabilitySink;
import com.questrail.repomon.transport.TransportFactory;
import com.questrail.repomon.transport.netty.NettyTransportFactory;

import java.io.InputStream;
import java.util.Objects;
import java.util.function.Function;

/**
 * BridgeRuntime
 * =============================================================================
 * Composition root for one bridge session.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>wiring and ownership component only</strong>. It
 * connects the wire codec, the console input bridge, the selected transport
 * and the forwarding driver. No forwarding semantics live here.
 *
 * <pre>
 *   InputStream ─▶ InputBridge ─▶ MessageHandoff ─▶ Transport ─▶ remote
 *   remote ─▶ Transport ─▶ ForwardingDriver ─▶ MessageOutput
 * </pre>
 */
public final class BridgeRuntime {
    private final ForwardingDriver driver;

    private BridgeRuntime(ForwardingDriver driver) {
        this.driver = driver;
    }

    /**
     * Runs the session until the inbound sequence ends.
     *
     * @throws com.questrail.repomon.error.BridgeException on a terminal failure
     */
    public void run() throws InterruptedException {
        driver.run();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BridgeConfig config = BridgeConfig.defaults();
        private InputStream input = System.in;
        private MessageOutput output;
        private BridgeObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock clock = SystemWallClock.INSTANCE;
        private Function<WireCodec, TransportFactory> transportFactory;

        public Builder withConfig(BridgeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withInput(InputStream input) {
            this.input = input;
            return this;
        }

        public Builder withOutput(MessageOutput output) {
            this.output = output;
            return this;
        }

        public Builder withObservabilitySink(BridgeObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Replaces the Netty transports, e.g. with fakes. The function receives
         * the session's configured codec.
         */
        public Builder withTransportFactory(Function<WireCodec, TransportFactory> transportFactory) {
            this.transportFactory = transportFactory;
            return this;
        }

        public BridgeRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(input, "input");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(clock, "clock");

            // 1. Codec with the configured failure policy
            WireCodec codec = new WireCodec(
                new BinaryMessageEncoder(config.maxFrameLength()),
                new BinaryMessageDecoder(),
                config.decodeFailurePolicy(),
                observabilitySink,
                clock
            );

            // 2. Transports
            TransportFactory transports = transportFactory != null
                ? transportFactory.apply(codec)
                : new NettyTransportFactory(codec, config.maxFrameLength(), observabilitySink, clock);

            // 3. Console input on its own thread
            InputBridge inputBridge = new InputBridge(
                input,
                new MessageHandoff(),
                InputMessageFactory.forMode(config.inputMode()),
                config.chunkSize(),
                observabilitySink,
                clock
            );

            // 4. Driver owns the session lifecycle
            MessageOutput effectiveOutput = output != null ? output : ConsoleMessageOutput.of(System.out);
            ForwardingDriver driver = new ForwardingDriver(
                config,
                transports,
                inputBridge,
                effectiveOutput,
                observabilitySink,
                clock
            );

            return new BridgeRuntime(driver);
        }
    }
}
