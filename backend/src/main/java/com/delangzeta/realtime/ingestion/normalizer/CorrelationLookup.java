package com.delangzeta.realtime.ingestion.normalizer;

import java.util.Optional;

/**
 * Resolves the user a chain event concerns when the log itself does not carry it.
 */
public interface CorrelationLookup {

    /** Owner of a submission, by submission id or by the keccak hash the contract indexes. */
    Optional<String> findSubmissionOwner(String submissionIdOrHash);

    Optional<String> findOperationInitiator(String operationId);
}
