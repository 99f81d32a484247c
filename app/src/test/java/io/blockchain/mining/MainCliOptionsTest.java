package io.blockchain.mining;

import io.blockchain.mining.node.NodeConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MainCliOptionsTest {

    @Test
    void parsesDefaults() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {});
        assertFalse(options.showHelp());
        assertNull(options.errorMessage());
        assertEquals(Path.of("./data/mining").normalize(), options.dataDir().normalize());
        assertEquals("regtest", options.network());
        assertTrue(options.peerToPeer());
        assertFalse(options.enableRpc());
        assertEquals(9090, options.rpcPort());
        assertEquals(0, options.minerThreads());
        assertNull(options.minerAddress());
    }

    @Test
    void parsesMiningAndRpcFlags() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {
                "--in-memory",
                "--network=posregtest",
                "--no-p2p",
                "--enable-rpc",
                "--rpc-bind=0.0.0.0",
                "--rpc-port=9191",
                "--rpc-token=test-rpc",
                "--miner-address=00112233445566778899aabbccddeeff00112233",
                "--miner-threads=2",
                "--longpoll-timeout-ms=1500",
                "--longpoll-recheck-ms=250",
                "--template-cooldown-ms=100"
        });
        assertNull(options.errorMessage());
        assertTrue(options.inMemory());
        assertFalse(options.peerToPeer());
        assertTrue(options.enableRpc());
        assertTrue(options.keepAlive());
        assertEquals("0.0.0.0", options.rpcBind());
        assertEquals(9191, options.rpcPort());
        assertEquals("test-rpc", options.rpcToken());

        NodeConfig config = options.toConfig();
        assertEquals("posregtest", config.params.name());
        assertFalse(config.peerToPeer);
        assertEquals(2, config.minerThreads);
        assertEquals("00112233445566778899aabbccddeeff00112233", config.minerAddress);
        assertEquals(Duration.ofMillis(1500), config.longPollTimeout);
        assertEquals(Duration.ofMillis(250), config.longPollRecheck);
        assertEquals(Duration.ofMillis(100), config.templateCooldown);
    }

    @Test
    void positionalArgumentIsDataDir() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"/tmp/chain"});
        assertEquals(Path.of("/tmp/chain"), options.dataDir());
    }

    @Test
    void invalidValuesSetError() {
        Main.CliOptions badPort = Main.CliOptions.parse(new String[] {"--rpc-port=70000"});
        assertTrue(badPort.showHelp());
        assertEquals("Invalid port for --rpc-port: 70000", badPort.errorMessage());

        Main.CliOptions badTimeout = Main.CliOptions.parse(new String[] {"--longpoll-timeout-ms=0"});
        assertTrue(badTimeout.errorMessage().contains("--longpoll-timeout-ms"));

        Main.CliOptions badAddress = Main.CliOptions.parse(new String[] {"--miner-address=xyz"});
        assertEquals("Invalid miner address: xyz", badAddress.errorMessage());

        Main.CliOptions badNetwork = Main.CliOptions.parse(new String[] {"--network=moon"});
        assertEquals("Unknown network: moon", badNetwork.errorMessage());
    }

    @Test
    void unknownFlagTriggersHelp() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--unknown-flag"});
        assertTrue(options.showHelp());
        assertEquals("Unknown option: --unknown-flag", options.errorMessage());
    }
}
