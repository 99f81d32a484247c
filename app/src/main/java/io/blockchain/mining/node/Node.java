package io.blockchain.mining.node;

import io.blockchain.mining.assembler.MempoolBlockAssembler;
import io.blockchain.mining.chain.BestBlockSignal;
import io.blockchain.mining.chain.ChainIndex;
import io.blockchain.mining.info.MiningInfoService;
import io.blockchain.mining.info.StakeView;
import io.blockchain.mining.mempool.Mempool;
import io.blockchain.mining.mempool.TxValidator;
import io.blockchain.mining.miner.DirectMiner;
import io.blockchain.mining.miner.MinerController;
import io.blockchain.mining.protocol.Address;
import io.blockchain.mining.protocol.Script;
import io.blockchain.mining.rpc.MiningRpcMethods;
import io.blockchain.mining.storage.ChainStore;
import io.blockchain.mining.storage.InMemoryChainStore;
import io.blockchain.mining.storage.RocksDBChainStore;
import io.blockchain.mining.submit.SubmissionService;
import io.blockchain.mining.template.BlockTemplateCache;
import io.blockchain.mining.template.LongPollCoordinator;
import io.blockchain.mining.template.TemplateService;
import io.blockchain.mining.validation.ChainValidationEngine;
import io.blockchain.mining.validation.ValidationEvents;

import java.time.Clock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires storage, chain index, mempool, assembler, validation and the mining services.
 */
public final class Node implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Node.class.getName());

    private final NodeConfig config;
    private final ChainStore store;
    private final ShutdownSignal shutdown = new ShutdownSignal();
    private final BestBlockSignal bestBlock = new BestBlockSignal();
    private final ChainIndex chain;
    private final Mempool mempool;
    private final ValidationEvents events = new ValidationEvents();
    private final ChainValidationEngine engine;
    private final MempoolBlockAssembler assembler;
    private final BlockTemplateCache templateCache;
    private final TemplateService templates;
    private final SubmissionService submissions;
    private final DirectMiner miner;
    private final MinerController minerController;
    private final MiningInfoService miningInfo;
    private final MiningRpcMethods rpcMethods;

    public Node(NodeConfig config, ChainStore store, Clock clock) {
        this.config = config;
        this.store = store;
        this.chain = new ChainIndex(store, config.params, bestBlock, clock, GenesisBuilder.build(config.params));
        this.mempool = new Mempool(new TxValidator(config.minRelayFee));
        this.engine = new ChainValidationEngine(chain, config.params, events, clock);
        this.assembler = new MempoolBlockAssembler(chain, mempool, config.params, clock);
        this.templateCache = new BlockTemplateCache(chain, mempool, assembler, clock, config.templateCooldown);

        PeerManager peers = config.peerToPeer ? PeerManager.standalone() : null;
        LongPollCoordinator longPoll = new LongPollCoordinator(chain, mempool, bestBlock, shutdown,
                config.longPollTimeout, config.longPollRecheck);
        this.templates = new TemplateService(chain, templateCache, longPoll, engine, peers, config.params,
                clock, config.nodeName);
        this.submissions = new SubmissionService(chain, engine, events);
        this.miner = new DirectMiner(templateCache, engine, shutdown, config.params);
        this.minerController = new MinerController(miner, config.params, peers, shutdown, payoutScript(config));
        this.miningInfo = new MiningInfoService(chain, mempool, assembler, config.params,
                minerController::hashesPerMinute, StakeView.NONE, clock);
        this.rpcMethods = new MiningRpcMethods(templates, submissions, miningInfo, mempool, miner, minerController);

        chain.addTipListener(block -> {
            int removed = mempool.removeConfirmed(block);
            if (removed > 0) {
                LOG.fine(() -> "Removed " + removed + " confirmed transactions from mempool");
            }
        });
        shutdown.addListener(bestBlock::wakeAll);
    }

    /** In-memory node on the system clock. */
    public static Node inMemory(NodeConfig config) {
        return new Node(config, new InMemoryChainStore(), Clock.systemUTC());
    }

    /** RocksDB-backed node on the system clock. */
    public static Node rocks(NodeConfig config, String dataDir) {
        return new Node(config, RocksDBChainStore.open(dataDir), Clock.systemUTC());
    }

    /** Starts the configured miner threads, if any. */
    public void start() {
        LOG.info(() -> "Node " + config.nodeName + " on " + config.params.name() + " at height "
                + chain.currentTip().height());
        if (config.minerThreads != 0) {
            minerController.start(config.minerThreads);
        }
    }

    /** Stops mining, wakes long polls and closes storage. */
    @Override
    public void close() {
        shutdown.request();
        try {
            store.close();
        } catch (Exception e) {
            LOG.log(Level.WARNING, "Failed to close chain store", e);
        }
    }

    private static Script payoutScript(NodeConfig config) {
        if (config.minerAddress == null || config.minerAddress.isBlank()) {
            return null;
        }
        return Address.parse(config.minerAddress).toScript();
    }

    public NodeConfig config() { return config; }
    public ShutdownSignal shutdown() { return shutdown; }
    public ChainIndex chain() { return chain; }
    public Mempool mempool() { return mempool; }
    public ValidationEvents events() { return events; }
    public ChainValidationEngine engine() { return engine; }
    public BlockTemplateCache templateCache() { return templateCache; }
    public TemplateService templates() { return templates; }
    public SubmissionService submissions() { return submissions; }
    public DirectMiner miner() { return miner; }
    public MinerController minerController() { return minerController; }
    public MiningInfoService miningInfo() { return miningInfo; }
    public MiningRpcMethods rpcMethods() { return rpcMethods; }
}
