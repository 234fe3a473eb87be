package com.actiongate.driver;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Output of {@link ActionDriver#simulate}. Simulation never mutates external state.
 *
 * @param slippageBps slippage observed in simulation, when the driver can derive it
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SimulationResult(boolean ok, Map<String, Object> diagnostics, Long unitsConsumed, Integer slippageBps) {

    public SimulationResult {
        diagnostics = diagnostics == null ? Map.of() : diagnostics;
    }
}
