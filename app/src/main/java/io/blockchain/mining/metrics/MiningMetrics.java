package io.blockchain.mining.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

public class MiningMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter templateRebuilds = registry.counter("template.rebuilds");
    private static final Timer templateBuildTime = registry.timer("template.build.time");
    private static final Counter blocksMined = registry.counter("miner.blocks.mined");
    private static final Counter hashes = registry.counter("miner.hashes");

    public static void recordTemplateBuild(Duration elapsed) {
        templateBuildTime.record(elapsed);
    }

    public static void incrementTemplateRebuilds() {
        templateRebuilds.increment();
    }

    public static double templateRebuilds() {
        return templateRebuilds.count();
    }

    public static void incrementBlocksMined() {
        blocksMined.increment();
    }

    public static void recordHashes(long count) {
        hashes.increment(count);
    }

    /** Long-poll wake reasons, tagged by result. */
    public static void recordLongPoll(String result) {
        registry.counter("template.longpoll", "result", result).increment();
    }

    /** Submission results, tagged by kind (block/header/proposal) and result string. */
    public static void recordSubmission(String kind, String result) {
        registry.counter("submission.results", "kind", kind, "result", result).increment();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                sb.append("{stat=").append(meas.getStatistic());
                m.getId().getTags().forEach(t -> sb.append(',').append(t.getKey()).append('=').append(t.getValue()));
                sb.append("} ").append(meas.getValue()).append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
