package io.blockchain.mining.assembler;

/** Size of the most recently assembled block; {@code txCount} excludes the coinbase. */
public record AssemblyStats(long weight, long txCount) {}
