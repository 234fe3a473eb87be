package com.actiongate.config;

import com.actiongate.failover.FailoverStateStore;
import com.actiongate.failover.UpstreamCaller;
import com.actiongate.failover.UpstreamErrorClassifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Timeout, retry and endpoint rotation around driver calls.
 */
@Configuration
public class ResilienceConfiguration {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService driverCallExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "driver-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public UpstreamErrorClassifier upstreamErrorClassifier() {
        return new UpstreamErrorClassifier();
    }

    @Bean
    public FailoverStateStore failoverStateStore(Path stateDir, ObjectMapper objectMapper,
                                                 ActionGateProperties properties, Clock clock) {
        return new FailoverStateStore(stateDir, objectMapper, properties.getUpstreams(), clock);
    }

    @Bean
    public UpstreamCaller upstreamCaller(FailoverStateStore failoverState,
                                         UpstreamErrorClassifier classifier,
                                         ExecutorService driverCallExecutor,
                                         ActionGateProperties properties) {
        ActionGateProperties.Retry retry = properties.getRetry();
        return new UpstreamCaller(failoverState, classifier, driverCallExecutor, properties.getDriverTimeout(),
            retry.getMaxAttempts(), retry.getInitialBackoff(), retry.getMultiplier());
    }
}
