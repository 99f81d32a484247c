package io.blockchain.mining;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.blockchain.mining.consensus.ConsensusParams;
import io.blockchain.mining.node.Node;
import io.blockchain.mining.node.NodeConfig;
import io.blockchain.mining.protocol.Address;
import io.blockchain.mining.rpc.RpcServer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Stream;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        installLogging();
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        NodeConfig config = options.toConfig();
        Node node;
        if (options.inMemory()) {
            node = Node.inMemory(config);
            LOG.info("Using in-memory chain store");
        } else {
            Path dataPath = options.dataDir().toAbsolutePath().normalize();
            if (options.resetChain()) {
                resetChainState(dataPath);
            }
            Files.createDirectories(dataPath);
            node = Node.rocks(config, dataPath.toString());
        }

        RpcServer rpcServer = null;
        try {
            node.start();
            if (options.enableRpc()) {
                rpcServer = new RpcServer(node.rpcMethods(), options.rpcBind(), options.rpcPort(), options.rpcToken());
                rpcServer.start();
            }

            if (options.keepAlive()) {
                CountDownLatch shutdownLatch = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    node.shutdown().request();
                    shutdownLatch.countDown();
                }, "mining-node-shutdown"));
                LOG.info("Node running. Press CTRL+C to exit.");
                shutdownLatch.await();
            } else {
                LOG.info(() -> "Mining info: " + toJson(node.miningInfo().info()));
            }
        } finally {
            if (rpcServer != null) {
                rpcServer.stop();
            }
            node.close();
        }
    }

    private static void installLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to load bundled logging.properties", e);
        }
    }

    private static String toJson(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to render " + value, e);
        }
    }

    private static void resetChainState(Path dataPath) {
        if (!Files.exists(dataPath)) {
            return;
        }
        try (Stream<Path> stream = Files.walk(dataPath)) {
            stream.sorted(Comparator.reverseOrder())
                    .filter(path -> !path.equals(dataPath))
                    .forEach(path -> {
                        try {
                            Files.deleteIfExists(path);
                        } catch (IOException e) {
                            throw new IllegalStateException("Failed to delete " + path, e);
                        }
                    });
        } catch (IOException e) {
            throw new IllegalStateException("Failed to reset chain data in " + dataPath, e);
        }
        LOG.info("Cleared chain data under " + dataPath);
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            boolean inMemory,
            boolean resetChain,
            String network,
            boolean peerToPeer,
            boolean keepAlive,
            boolean enableRpc,
            String rpcBind,
            int rpcPort,
            String rpcToken,
            String minerAddress,
            int minerThreads,
            long longPollTimeoutMillis,
            long longPollRecheckMillis,
            long templateCooldownMillis
    ) {
        static CliOptions parse(String[] args) {
            NodeConfig defaults = NodeConfig.defaultLocal();
            Path dataDir = envPath("JAVA_CHAIN_DATA_DIR", Path.of("./data/mining"));
            boolean inMemory = "true".equalsIgnoreCase(System.getenv("JAVA_CHAIN_IN_MEMORY"));
            boolean reset = false;
            String network = envOrDefault("JAVA_CHAIN_NETWORK", defaults.params.name());
            boolean peerToPeer = !"false".equalsIgnoreCase(System.getenv("JAVA_CHAIN_ENABLE_P2P"));
            boolean keepAlive = false;
            boolean enableRpc = "true".equalsIgnoreCase(System.getenv("JAVA_CHAIN_ENABLE_RPC"));
            String rpcBind = envOrDefault("JAVA_CHAIN_RPC_BIND", "127.0.0.1");
            int rpcPort = 9090;
            String rpcToken = System.getenv("JAVA_CHAIN_RPC_TOKEN");
            String minerAddress = envOrDefault("JAVA_CHAIN_MINER_ADDRESS", null);
            int minerThreads = defaults.minerThreads;
            long longPollTimeout = defaults.longPollTimeout.toMillis();
            long longPollRecheck = defaults.longPollRecheck.toMillis();
            long templateCooldown = defaults.templateCooldown.toMillis();
            boolean showHelp = false;
            String error = null;

            try {
                rpcPort = envPort("JAVA_CHAIN_RPC_PORT", rpcPort);
                String threadsEnv = System.getenv("JAVA_CHAIN_MINER_THREADS");
                if (threadsEnv != null && !threadsEnv.isBlank()) {
                    minerThreads = parseInt(threadsEnv, "JAVA_CHAIN_MINER_THREADS");
                }
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    try {
                        if ("--help".equals(arg) || "-h".equals(arg)) {
                            showHelp = true;
                        } else if (arg.startsWith("--data-dir=")) {
                            dataDir = Path.of(arg.substring("--data-dir=".length()));
                        } else if (arg.equals("--in-memory")) {
                            inMemory = true;
                        } else if (arg.equals("--reset-chain")) {
                            reset = true;
                        } else if (arg.startsWith("--network=")) {
                            network = arg.substring("--network=".length()).trim();
                        } else if (arg.equals("--no-p2p")) {
                            peerToPeer = false;
                        } else if (arg.equals("--keep-alive")) {
                            keepAlive = true;
                        } else if (arg.equals("--enable-rpc")) {
                            enableRpc = true;
                        } else if (arg.startsWith("--rpc-bind=")) {
                            rpcBind = arg.substring("--rpc-bind=".length());
                        } else if (arg.startsWith("--rpc-port=")) {
                            rpcPort = parsePort(arg.substring("--rpc-port=".length()), "--rpc-port");
                        } else if (arg.startsWith("--rpc-token=")) {
                            rpcToken = arg.substring("--rpc-token=".length());
                        } else if (arg.startsWith("--miner-address=")) {
                            minerAddress = arg.substring("--miner-address=".length()).trim();
                        } else if (arg.startsWith("--miner-threads=")) {
                            minerThreads = parseInt(arg.substring("--miner-threads=".length()), "--miner-threads");
                        } else if (arg.startsWith("--longpoll-timeout-ms=")) {
                            longPollTimeout = parsePositiveLong(arg.substring("--longpoll-timeout-ms=".length()), "--longpoll-timeout-ms");
                        } else if (arg.startsWith("--longpoll-recheck-ms=")) {
                            longPollRecheck = parsePositiveLong(arg.substring("--longpoll-recheck-ms=".length()), "--longpoll-recheck-ms");
                        } else if (arg.startsWith("--template-cooldown-ms=")) {
                            templateCooldown = parsePositiveLong(arg.substring("--template-cooldown-ms=".length()), "--template-cooldown-ms");
                        } else if (!arg.startsWith("--")) {
                            dataDir = Path.of(arg);
                        } else if (error == null) {
                            showHelp = true;
                            error = "Unknown option: " + arg;
                        }
                    } catch (IllegalArgumentException ex) {
                        showHelp = true;
                        error = ex.getMessage();
                    }
                }
            }

            if (minerAddress != null && minerAddress.isBlank()) {
                minerAddress = null;
            }
            if (error == null && minerAddress != null && !Address.isValid(minerAddress)) {
                showHelp = true;
                error = "Invalid miner address: " + minerAddress;
            }
            if (error == null) {
                try {
                    ConsensusParams.forName(network);
                } catch (IllegalArgumentException ex) {
                    showHelp = true;
                    error = ex.getMessage();
                }
            }
            if (rpcToken != null && rpcToken.isBlank()) {
                rpcToken = null;
            }

            keepAlive = keepAlive || enableRpc || minerThreads != 0
                    || "true".equalsIgnoreCase(System.getenv("JAVA_CHAIN_KEEP_ALIVE"));

            return new CliOptions(
                    showHelp,
                    error,
                    dataDir,
                    inMemory,
                    reset,
                    network,
                    peerToPeer,
                    keepAlive,
                    enableRpc,
                    rpcBind,
                    rpcPort,
                    rpcToken,
                    minerAddress,
                    minerThreads,
                    longPollTimeout,
                    longPollRecheck,
                    templateCooldown
            );
        }

        NodeConfig toConfig() {
            return NodeConfig.defaultLocal()
                    .withParams(ConsensusParams.forName(network))
                    .withPeerToPeer(peerToPeer)
                    .withMiner(minerAddress, minerThreads)
                    .withLongPoll(Duration.ofMillis(longPollTimeoutMillis), Duration.ofMillis(longPollRecheckMillis))
                    .withTemplateCooldown(Duration.ofMillis(templateCooldownMillis));
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: blockchain-mining [options]

Options:
  --help, -h                   Show this help message and exit
  --data-dir=<path>            Path for chain data (default ./data/mining)
  --in-memory                  Keep the chain in memory instead of RocksDB
  --reset-chain                Delete chain data before starting
  --network=<name>             regtest (default), main or posregtest
  --no-p2p                     Run without peer-to-peer support (template and miner calls are refused)
  --keep-alive                 Keep the node running until interrupted
  --enable-rpc                 Start the JSON-RPC server (default bind 127.0.0.1:9090)
  --rpc-bind=<host>            Bind address for the RPC server
  --rpc-port=<port>            Port for the RPC server (default 9090)
  --rpc-token=<token>          Require Bearer/X-API-Key token for the RPC server
  --miner-address=<hex>        40-hex key hash paid by background mining (default OP_TRUE)
  --miner-threads=<n>          Start background mining with n threads (-1 = one per core)
  --longpoll-timeout-ms=<ms>   Long-poll wait before the mempool is checked (default 60000)
  --longpoll-recheck-ms=<ms>   Further wait when the mempool is unchanged (default 10000)
  --template-cooldown-ms=<ms>  Minimum age before mempool changes rebuild a template (default 5000)

Environment overrides:
  JAVA_CHAIN_DATA_DIR          Override --data-dir
  JAVA_CHAIN_IN_MEMORY         Set to "true" for an in-memory chain
  JAVA_CHAIN_NETWORK           Override --network
  JAVA_CHAIN_ENABLE_P2P        Set to "false" to disable peer-to-peer support
  JAVA_CHAIN_ENABLE_RPC        Set to "true" to enable RPC without CLI flag
  JAVA_CHAIN_RPC_BIND          Override --rpc-bind
  JAVA_CHAIN_RPC_PORT          Override --rpc-port
  JAVA_CHAIN_RPC_TOKEN         Token for RPC auth (if --rpc-token not supplied)
  JAVA_CHAIN_MINER_ADDRESS     Override --miner-address
  JAVA_CHAIN_MINER_THREADS     Override --miner-threads
  JAVA_CHAIN_KEEP_ALIVE        Set to "true" to force keep-alive mode
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static String envOrDefault(String key, String fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static int envPort(String key, int fallback) {
            String value = System.getenv(key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return parsePort(value, key);
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port < 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }

        private static int parseInt(String value, String flag) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }

        private static long parsePositiveLong(String value, String flag) {
            try {
                long parsed = Long.parseLong(value);
                if (parsed <= 0) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
