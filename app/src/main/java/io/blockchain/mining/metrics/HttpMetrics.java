package io.blockchain.mining.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

public final class HttpMetrics {
    private static final MeterRegistry REGISTRY = MiningMetrics.registry();

    private HttpMetrics() {}

    public static Timer.Sample start() {
        return Timer.start(REGISTRY);
    }

    /** {@code rpcMethod} is the JSON-RPC method name, or the HTTP path for plain requests. */
    public static void stop(Timer.Sample sample, String rpcMethod, int status) {
        Timer timer = Timer
                .builder("rpc.server.requests")
                .description("RPC request duration")
                .tag("method", rpcMethod)
                .tag("status", Integer.toString(status))
                .register(REGISTRY);
        sample.stop(timer);
    }
}
