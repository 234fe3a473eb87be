package com.actiongate.plan;

public record NodeError(String code, String message) {
}
