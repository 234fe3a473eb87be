package com.actiongate.driver;

import com.actiongate.audit.ArtifactHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic in-process driver for demos and tests. Touches no network.
 *
 * Recognized params besides the action's own: {@code targets} (identifiers reported as side
 * effects), {@code opaqueTargets} (report identifiers as unknown), {@code simulateFail},
 * {@code simulatedSlippageBps}, {@code failBuild} (build error message).
 */
public class SandboxDriver implements ActionDriver {

    private static final Logger log = LoggerFactory.getLogger(SandboxDriver.class);

    public static final String ID = "sandbox";

    private static final List<Capability> CAPABILITIES = List.of(
        new Capability("transfer", "medium", Map.of(
            "type", "object",
            "required", List.of("to", "amount"),
            "properties", Map.of("to", Map.of("type", "string"), "amount", Map.of("type", "number")))),
        new Capability("swap", "high", Map.of(
            "type", "object",
            "required", List.of("inputMint", "outputMint", "amount"),
            "properties", Map.of(
                "inputMint", Map.of("type", "string"),
                "outputMint", Map.of("type", "string"),
                "amount", Map.of("type", "number"),
                "slippageBps", Map.of("type", "integer"),
                "disableMinOut", Map.of("type", "boolean")))),
        new Capability("noop", "low", Map.of("type", "object"))
    );

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String chain() {
        return "sandbox";
    }

    @Override
    public List<Capability> listCapabilities() {
        return CAPABILITIES;
    }

    @Override
    public BuildResult build(String action, Map<String, Object> params, DriverContext context) {
        Map<String, Object> p = params == null ? Map.of() : params;
        if (p.get("failBuild") != null) {
            throw new DriverException("BUILD_ERROR", String.valueOf(p.get("failBuild")));
        }
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("action", action);
        switch (action) {
            case "transfer" -> {
                requireString(p, "to");
                meta.put("amount", requireNumber(p, "amount"));
            }
            case "swap" -> {
                requireString(p, "inputMint");
                requireString(p, "outputMint");
                meta.put("amount", requireNumber(p, "amount"));
                if (p.get("slippageBps") instanceof Number bps) {
                    meta.put("slippageBps", bps.intValue());
                }
                if (Boolean.TRUE.equals(p.get("disableMinOut"))) {
                    meta.put("slippageGuardDisabled", true);
                }
            }
            default -> {
            }
        }
        Map<String, Object> payload = new TreeMap<>();
        payload.put("kind", "sandbox");
        payload.put("action", action);
        payload.put("network", context.network());
        payload.put("params", new TreeMap<>(p));
        return new BuildResult(payload, meta);
    }

    @Override
    public SimulationResult simulate(Map<String, Object> payload, DriverContext context) {
        Map<?, ?> params = params(payload);
        if (Boolean.TRUE.equals(params.get("simulateFail"))) {
            return new SimulationResult(false, Map.of("error", "simulated failure", "logs", List.of("sandbox: revert")),
                0L, null);
        }
        Integer slippage = params.get("simulatedSlippageBps") instanceof Number n ? n.intValue() : null;
        return new SimulationResult(true, Map.of("logs", List.of("sandbox: ok")), 5_000L, slippage);
    }

    @Override
    public SideEffectIds extractSideEffectIds(Map<String, Object> payload, DriverContext context) {
        Map<?, ?> params = params(payload);
        if (Boolean.TRUE.equals(params.get("opaqueTargets"))) {
            return SideEffectIds.unknown();
        }
        List<String> ids = new ArrayList<>();
        if (params.get("targets") instanceof List<?> targets) {
            for (Object t : targets) {
                ids.add(String.valueOf(t));
            }
        }
        return SideEffectIds.known(ids);
    }

    @Override
    public BroadcastReceipt broadcast(Map<String, Object> payload, List<String> signers, DriverContext context) {
        String receipt = "sandbox_tx_" + ArtifactHasher.sha256Hex(new TreeMap<>(payload).toString()).substring(0, 16);
        log.info("Sandbox broadcast trace={} receipt={}", context.traceId(), receipt);
        return new BroadcastReceipt(receipt);
    }

    @Override
    public ConfirmationStatus awaitConfirmation(String receiptId, DriverContext context) {
        return ConfirmationStatus.CONFIRMED;
    }

    private static Map<?, ?> params(Map<String, Object> payload) {
        return payload.get("params") instanceof Map<?, ?> m ? m : Map.of();
    }

    private static void requireString(Map<?, ?> params, String key) {
        if (!(params.get(key) instanceof String s) || s.isBlank()) {
            throw new DriverException("BUILD_ERROR", "param '" + key + "' must be a non-empty string");
        }
    }

    private static double requireNumber(Map<?, ?> params, String key) {
        if (!(params.get(key) instanceof Number n)) {
            throw new DriverException("BUILD_ERROR", "param '" + key + "' must be a number");
        }
        return n.doubleValue();
    }
}
