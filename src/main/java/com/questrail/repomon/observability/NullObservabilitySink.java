package com.questrail.repomon.observability;

/**
 * No-op implementation of BridgeObservabilitySink.
 */
public final class NullObservabilitySink implements BridgeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onInputEvent(InputObservabilityEvent event) {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onCodecFailure(CodecFailureEvent event) {}

    @Override
    public void onError(BridgeErrorEvent event) {}
}
