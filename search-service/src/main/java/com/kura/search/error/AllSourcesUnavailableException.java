package com.kura.search.error;

/**
 * Neither the vector nor the lexical backend could answer. Distinct from an
 * empty result so callers can tell "no matches" from "search is down".
 */
public class AllSourcesUnavailableException extends SearchException {

    public AllSourcesUnavailableException(String message) {
        super(ErrorCode.SERVICE_UNAVAILABLE, message, true);
    }
}
