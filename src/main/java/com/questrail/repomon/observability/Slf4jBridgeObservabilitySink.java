package com.questrail.repomon.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BridgeObservabilitySink that emits logs via SLF4J.
 *
 * <p>Decode failures land here at WARN; this is the diagnostic channel for
 * malformed frames.</p>
 */
public final class Slf4jBridgeObservabilitySink implements BridgeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBridgeObservabilitySink.class);

    @Override
    public void onInputEvent(InputObservabilityEvent event) {
        switch (event.type()) {
            case READ_FAILED -> log.warn("Console input failed, no further input will be sent", event.cause());
            case END_OF_INPUT -> log.info("Console input reached end of input");
            default -> log.debug("Console input: {}", event.type());
        }
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        if (event.type() == TransportObservabilityEvent.Type.OUTBOUND_DRAINED) {
            log.debug("{} transport: outbound drained", event.transport());
            return;
        }
        log.info("{} transport {} {}",
            event.transport(),
            event.type(),
            event.address() != null ? event.address() : "");
    }

    @Override
    public void onCodecFailure(CodecFailureEvent event) {
        log.warn("{} codec failure: {}", event.direction(), event.message(), event.cause());
    }

    @Override
    public void onError(BridgeErrorEvent event) {
        log.error("Bridge error: {}", event.message(), event.cause());
    }
}
