package io.blockchain.mining.template;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** One non-coinbase transaction of a block template. */
@JsonPropertyOrder({"data", "txid", "hash", "depends", "fee", "sigops", "weight"})
public record TemplateTransaction(String data, String txid, String hash, List<Integer> depends,
                                  long fee, long sigops, long weight) {}
