package com.demo.lending.exception;

public class UnknownTokenException extends LendingException {

    public UnknownTokenException(int tokenId) {
        super(Reason.UNKNOWN_TOKEN, "Token " + tokenId + " is not registered");
    }
}
