package io.blockchain.mining.metrics;

import io.blockchain.mining.protocol.Script;
import io.blockchain.mining.support.TestChain;
import io.blockchain.mining.template.BlockTemplateCache;
import io.micrometer.core.instrument.Timer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MiningMetricsTest {

    @Test
    void templateRebuildsAreCounted() {
        TestChain t = TestChain.regtest();
        BlockTemplateCache cache = new BlockTemplateCache(t.chain, t.mempool, t.assembler, t.clock);
        double before = MiningMetrics.templateRebuilds();

        cache.rebuild(Script.ANYONE_CAN_SPEND);

        assertEquals(before + 1, MiningMetrics.templateRebuilds());
    }

    @Test
    void scrapeListsTaggedCounters() {
        MiningMetrics.recordSubmission("block", "high-hash");
        MiningMetrics.recordLongPoll("TIP_CHANGED");

        String scrape = MiningMetrics.scrapeMetrics();

        assertTrue(scrape.contains("submission.results{stat=COUNT"));
        assertTrue(scrape.contains("result=high-hash"));
        assertTrue(scrape.contains("template.longpoll{stat=COUNT"));
    }

    @Test
    void httpTimerIsTaggedByMethodAndStatus() {
        Timer.Sample sample = HttpMetrics.start();
        HttpMetrics.stop(sample, "getmininginfo", 200);

        Timer timer = MiningMetrics.registry().find("rpc.server.requests")
                .tags("method", "getmininginfo", "status", "200").timer();
        assertNotNull(timer);
        assertTrue(timer.count() >= 1);
    }
}
