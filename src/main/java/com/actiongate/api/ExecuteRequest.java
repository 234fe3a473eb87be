package com.actiongate.api;

public record ExecuteRequest(String preparedId, Boolean confirm, Boolean waitForConfirmation) {
}
