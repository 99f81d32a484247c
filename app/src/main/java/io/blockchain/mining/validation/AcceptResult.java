package io.blockchain.mining.validation;

/**
 * Outcome of handing a block to the engine.
 * {@code accepted} is false on rejection; {@code newBlock} is true only if the block was stored for the first time.
 */
public record AcceptResult(boolean accepted, boolean newBlock) {}
