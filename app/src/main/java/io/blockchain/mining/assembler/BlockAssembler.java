package io.blockchain.mining.assembler;

import io.blockchain.mining.protocol.Script;

import java.util.Optional;

public interface BlockAssembler {

    /** Builds a candidate on the current tip paying to {@code coinbaseScript}. */
    CandidateBlock createNewBlock(Script coinbaseScript) throws BlockAssemblyException;

    /** Stats of the last successful assembly, if any. */
    default Optional<AssemblyStats> lastStats() {
        return Optional.empty();
    }
}
