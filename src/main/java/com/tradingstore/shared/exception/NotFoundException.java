package com.tradingstore.shared.exception;

public class NotFoundException extends StoreException {

    public NotFoundException(String message) {
        super(message);
    }
}
