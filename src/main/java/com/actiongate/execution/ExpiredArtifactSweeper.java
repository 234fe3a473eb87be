package com.actiongate.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;

/**
 * Periodically drops expired prepared artifacts. Execute checks expiry itself, so a slow sweep
 * never lets an expired artifact through.
 */
public class ExpiredArtifactSweeper {

    private static final Logger log = LoggerFactory.getLogger(ExpiredArtifactSweeper.class);

    private final PreparedArtifactStore preparedStore;
    private final Clock clock;

    public ExpiredArtifactSweeper(PreparedArtifactStore preparedStore, Clock clock) {
        this.preparedStore = preparedStore;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${actiongate.sweep-interval:PT10S}")
    public void sweep() {
        sweepNow();
    }

    public int sweepNow() {
        int removed = preparedStore.sweepExpired(clock.instant());
        if (removed > 0) {
            log.info("Swept {} expired prepared artifacts", removed);
        }
        return removed;
    }
}
