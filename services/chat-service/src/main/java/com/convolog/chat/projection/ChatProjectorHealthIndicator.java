package com.convolog.chat.projection;

import java.util.Set;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Reports the projector as down when it is stopped, and as degraded while streams wait for a
 * repair catch-up.
 */
public class ChatProjectorHealthIndicator implements HealthIndicator {

    private final ChatProjector projector;

    public ChatProjectorHealthIndicator(ChatProjector projector) {
        this.projector = projector;
    }

    @Override
    public Health health() {
        if (!projector.isRunning()) {
            return Health.down().withDetail("running", false).build();
        }
        Set<String> failed = projector.failedStreams();
        if (!failed.isEmpty()) {
            return Health.status("DEGRADED").withDetail("failedStreams", failed).build();
        }
        return Health.up().build();
    }
}
