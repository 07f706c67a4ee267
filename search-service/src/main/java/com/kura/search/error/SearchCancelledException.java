package com.kura.search.error;

public class SearchCancelledException extends SearchException {

    public SearchCancelledException(String message, Throwable cause) {
        super(ErrorCode.REQUEST_CANCELLED, message, true, cause);
    }
}
