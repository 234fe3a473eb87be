package com.actiongate.config;

import com.actiongate.driver.ActionDriver;
import com.actiongate.driver.DriverRegistry;
import com.actiongate.driver.SandboxDriver;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DriverConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "actiongate.sandbox", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SandboxDriver sandboxDriver() {
        return new SandboxDriver();
    }

    /**
     * Every {@link ActionDriver} bean in the context, registered by id.
     */
    @Bean
    public DriverRegistry driverRegistry(ObjectProvider<ActionDriver> drivers) {
        return new DriverRegistry(drivers.orderedStream().toList());
    }
}
