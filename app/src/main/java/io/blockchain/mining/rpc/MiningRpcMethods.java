package io.blockchain.mining.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import io.blockchain.mining.error.ErrorCode;
import io.blockchain.mining.error.MiningException;
import io.blockchain.mining.info.MiningInfoService;
import io.blockchain.mining.mempool.Mempool;
import io.blockchain.mining.miner.DirectMiner;
import io.blockchain.mining.miner.MinerController;
import io.blockchain.mining.protocol.Address;
import io.blockchain.mining.protocol.Descriptor;
import io.blockchain.mining.protocol.Hash;
import io.blockchain.mining.protocol.Hex;
import io.blockchain.mining.protocol.Script;
import io.blockchain.mining.submit.SubmissionService;
import io.blockchain.mining.template.TemplateRequest;
import io.blockchain.mining.template.TemplateService;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The mining JSON-RPC methods. Results are plain objects for Jackson; failures are {@link MiningException}s.
 */
public final class MiningRpcMethods {
    static final long DEFAULT_MAX_TRIES = 1_000_000;

    private static final Map<String, List<String>> ARGUMENTS = new LinkedHashMap<>();
    static {
        ARGUMENTS.put("getblocktemplate", List.of("template_request"));
        ARGUMENTS.put("submitblock", List.of("hexdata", "dummy"));
        ARGUMENTS.put("submitheader", List.of("hexdata"));
        ARGUMENTS.put("getmininginfo", List.of());
        ARGUMENTS.put("prioritisetransaction", List.of("txid", "dummy", "fee_delta"));
        ARGUMENTS.put("generatetoaddress", List.of("nblocks", "address", "maxtries"));
        ARGUMENTS.put("generatetodescriptor", List.of("num_blocks", "descriptor", "maxtries"));
        ARGUMENTS.put("minerstart", List.of("nthreads"));
        ARGUMENTS.put("minerstop", List.of());
        ARGUMENTS.put("minerstatus", List.of());
    }

    private final TemplateService templates;
    private final SubmissionService submissions;
    private final MiningInfoService info;
    private final Mempool mempool;
    private final DirectMiner miner;
    private final MinerController controller;

    public MiningRpcMethods(TemplateService templates, SubmissionService submissions, MiningInfoService info,
                            Mempool mempool, DirectMiner miner, MinerController controller) {
        this.templates = templates;
        this.submissions = submissions;
        this.info = info;
        this.mempool = mempool;
        this.miner = miner;
        this.controller = controller;
    }

    public Set<String> methods() {
        return Collections.unmodifiableSet(ARGUMENTS.keySet());
    }

    /**
     * Runs {@code method}. {@code params} may be an array, an object or null.
     *
     * @throws InterruptedException if a long-polling {@code getblocktemplate} is interrupted
     */
    public Object call(String method, JsonNode params) throws InterruptedException {
        List<String> names = method == null ? null : ARGUMENTS.get(method);
        if (names == null) {
            throw new MiningException(ErrorCode.METHOD_NOT_FOUND, "Method not found");
        }
        RpcParams p = new RpcParams(params, names);
        switch (method) {
            case "getblocktemplate": return getBlockTemplate(p);
            case "submitblock": return submissions.submitBlock(decode(p.requireString(0), "Block decode failed"));
            case "submitheader":
                submissions.submitHeader(decode(p.requireString(0), "Block header decode failed"));
                return null;
            case "getmininginfo": return info.info();
            case "prioritisetransaction": return prioritiseTransaction(p);
            case "generatetoaddress": return generateToAddress(p);
            case "generatetodescriptor": return generateToDescriptor(p);
            case "minerstart": return controller.start(p.requireInt(0));
            case "minerstop": return controller.stop();
            case "minerstatus": return controller.status();
            default: throw new MiningException(ErrorCode.METHOD_NOT_FOUND, "Method not found");
        }
    }

    private Object getBlockTemplate(RpcParams p) throws InterruptedException {
        JsonNode request = p.optionalObject(0);
        if (request == null) {
            return templates.handle(TemplateRequest.template());
        }
        String mode = null;
        JsonNode modeNode = request.get("mode");
        if (modeNode != null && !modeNode.isNull()) {
            if (!modeNode.isTextual()) {
                throw new MiningException(ErrorCode.INVALID_PARAMETER, "Invalid mode");
            }
            mode = modeNode.asText();
        }
        JsonNode lp = request.get("longpollid");
        String longPollId = lp != null && lp.isTextual() ? lp.asText() : null;
        JsonNode data = request.get("data");
        String dataHex = data != null && data.isTextual() ? data.asText() : null;
        return templates.handle(new TemplateRequest(mode, lp != null, longPollId, dataHex));
    }

    private Object prioritiseTransaction(RpcParams p) {
        Hash txid;
        try {
            txid = Hash.fromHex(p.requireString(0));
        } catch (IllegalArgumentException e) {
            throw new MiningException(ErrorCode.INVALID_PARAMETER, "txid " + e.getMessage(), e);
        }
        JsonNode dummy = p.get(1);
        if (dummy != null && !(dummy.isNumber() && dummy.asDouble() == 0.0)) {
            throw new MiningException(ErrorCode.INVALID_PARAMETER,
                    "Priority is no longer supported, dummy argument to prioritisetransaction must be 0.");
        }
        mempool.prioritise(txid, p.requireLong(2));
        return true;
    }

    private Object generateToAddress(RpcParams p) {
        int count = p.requireInt(0);
        String address = p.requireString(1);
        long maxTries = p.optionalLong(2, DEFAULT_MAX_TRIES);
        Script script;
        try {
            script = Address.parse(address).toScript();
        } catch (IllegalArgumentException e) {
            throw new MiningException(ErrorCode.INVALID_ADDRESS_OR_KEY, "Error: Invalid address", e);
        }
        return mine(script, count, maxTries);
    }

    private Object generateToDescriptor(RpcParams p) {
        int count = p.requireInt(0);
        String text = p.requireString(1);
        long maxTries = p.optionalLong(2, DEFAULT_MAX_TRIES);
        Descriptor descriptor;
        try {
            descriptor = Descriptor.parse(text);
        } catch (Descriptor.ParseException e) {
            throw new MiningException(ErrorCode.INVALID_ADDRESS_OR_KEY, e.getMessage(), e);
        }
        if (descriptor.isRanged()) {
            throw new MiningException(ErrorCode.INVALID_PARAMETER,
                    "Ranged descriptor not accepted. Maybe pass through deriveaddresses first?");
        }
        return mine(descriptor.script(), count, maxTries);
    }

    private List<String> mine(Script script, int count, long maxTries) {
        if (maxTries < 0) {
            throw new MiningException(ErrorCode.INVALID_PARAMETER, "maxtries must be non-negative");
        }
        List<String> hashes = new ArrayList<>();
        for (Hash h : miner.mineBlocks(script, count, maxTries)) {
            hashes.add(h.hex());
        }
        return hashes;
    }

    private static byte[] decode(String hex, String failure) {
        if (!Hex.isHex(hex)) {
            throw new MiningException(ErrorCode.DESERIALIZATION_ERROR, failure);
        }
        return Hex.decode(hex);
    }
}
