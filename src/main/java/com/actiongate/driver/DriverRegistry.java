package com.actiongate.driver;

import com.actiongate.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Registration table from adapter id to driver, resolved once at startup.
 */
public class DriverRegistry {

    private static final Logger log = LoggerFactory.getLogger(DriverRegistry.class);

    private final Map<String, ActionDriver> drivers;

    public DriverRegistry(Collection<? extends ActionDriver> drivers) {
        Map<String, ActionDriver> byId = new TreeMap<>();
        for (ActionDriver driver : drivers) {
            if (byId.putIfAbsent(driver.id(), driver) != null) {
                throw new IllegalStateException("duplicate driver id: " + driver.id());
            }
            log.info("Registered driver id={} chain={} actions={}", driver.id(), driver.chain(),
                driver.listCapabilities().stream().map(Capability::action).toList());
        }
        this.drivers = Collections.unmodifiableMap(byId);
    }

    public ActionDriver require(String adapter) {
        ActionDriver driver = adapter == null ? null : drivers.get(adapter);
        if (driver == null) {
            throw new ValidationException("UNKNOWN_ADAPTER", "unknown adapter: " + adapter);
        }
        return driver;
    }

    /**
     * Resolves the driver and checks that it declares {@code action}.
     */
    public ActionDriver require(String adapter, String action) {
        ActionDriver driver = require(adapter);
        boolean supported = driver.listCapabilities().stream().anyMatch(c -> c.action().equals(action));
        if (!supported) {
            throw new ValidationException("UNKNOWN_ACTION",
                "adapter " + adapter + " does not support action: " + action);
        }
        return driver;
    }

    /** Capabilities of every driver keyed by adapter id. */
    public Map<String, Object> describe() {
        Map<String, Object> out = new TreeMap<>();
        drivers.forEach((id, driver) -> {
            List<Capability> caps = new ArrayList<>(driver.listCapabilities());
            out.put(id, Map.of("chain", driver.chain(), "capabilities", caps));
        });
        return out;
    }
}
