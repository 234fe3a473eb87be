package com.actiongate.execution;

import java.util.Map;

public record PrepareRequest(String chain, String adapter, String action, Map<String, Object> params, String network) {
}
