package com.actiongate.driver;

import java.util.List;
import java.util.Map;

/**
 * Capability interface implemented per chain or protocol. The core reaches drivers only through
 * this interface.
 */
public interface ActionDriver {

    /** Adapter id used in requests. */
    String id();

    String chain();

    /** Name of the upstream endpoint pool this driver talks to, or null. */
    default String upstreamPool() {
        return null;
    }

    List<Capability> listCapabilities();

    BuildResult build(String action, Map<String, Object> params, DriverContext context);

    SimulationResult simulate(Map<String, Object> payload, DriverContext context);

    SideEffectIds extractSideEffectIds(Map<String, Object> payload, DriverContext context);

    /**
     * The only call permitted to change external state.
     *
     * @param signers references to the signing keys configured for the chain; never secrets
     */
    BroadcastReceipt broadcast(Map<String, Object> payload, List<String> signers, DriverContext context);

    default ConfirmationStatus awaitConfirmation(String receiptId, DriverContext context) {
        return ConfirmationStatus.UNKNOWN;
    }
}
