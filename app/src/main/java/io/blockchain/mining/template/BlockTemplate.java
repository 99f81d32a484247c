package io.blockchain.mining.template;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

/** {@code getblocktemplate} response; component names are the wire field names. */
@JsonPropertyOrder({"capabilities", "version", "rules", "previousblockhash", "transactions", "coinbaseaux",
        "coinbasevalue", "longpollid", "target", "mintime", "mutable", "noncerange", "sigoplimit", "sizelimit",
        "weightlimit", "curtime", "bits", "height"})
public record BlockTemplate(
        List<String> capabilities,
        int version,
        List<String> rules,
        String previousblockhash,
        List<TemplateTransaction> transactions,
        Map<String, String> coinbaseaux,
        long coinbasevalue,
        String longpollid,
        String target,
        long mintime,
        List<String> mutable,
        String noncerange,
        long sigoplimit,
        long sizelimit,
        long weightlimit,
        long curtime,
        String bits,
        long height) {

    public static final List<String> CAPABILITIES = List.of("proposal");
    public static final List<String> RULES = List.of("csv", "!segwit");
    public static final List<String> MUTABLE = List.of("time", "transactions", "prevblock");
    public static final String NONCE_RANGE = "00000000ffffffff";
}
