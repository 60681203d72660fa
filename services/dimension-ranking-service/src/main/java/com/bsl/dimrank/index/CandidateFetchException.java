package com.bsl.dimrank.index;

/**
 * The similarity index could not embed the query or return candidates. Always surfaced to the
 * caller as a failed ranking; never turned into an empty result.
 */
public class CandidateFetchException extends RuntimeException {
    public CandidateFetchException(String message) {
        super(message);
    }

    public CandidateFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
