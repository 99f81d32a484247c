package io.blockchain.mining.assembler;

/** The assembler could not produce a candidate (resource exhaustion or an inconsistent chain view). */
public class BlockAssemblyException extends Exception {
    public BlockAssemblyException(String message) {
        super(message);
    }

    public BlockAssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}
