package com.questrail.repomon.observability;

/**
 * Main interface for receiving bridge observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive from the input thread, the forwarder thread and the
 * network event loop; implementations must be thread-safe.</p>
 */
public interface BridgeObservabilitySink {
    /**
     * Called when the console input reader starts or stops.
     * @param event the input event
     */
    void onInputEvent(InputObservabilityEvent event);

    /**
     * Called when a transport-level event occurs (e.g., connected, closed).
     * @param event the transport event
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * Called when a frame could not be encoded or decoded.
     * @param event the codec failure
     */
    void onCodecFailure(CodecFailureEvent event);

    /**
     * Called when a session ends with a terminal error.
     * @param event the error event
     */
    void onError(BridgeErrorEvent event);
}
