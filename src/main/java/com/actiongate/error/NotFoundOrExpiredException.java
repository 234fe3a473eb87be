package com.actiongate.error;

public class NotFoundOrExpiredException extends ActionGateException {

    public NotFoundOrExpiredException(String preparedId) {
        super("PREPARED_NOT_FOUND_OR_EXPIRED", "prepared artifact not found or expired: " + preparedId);
    }
}
