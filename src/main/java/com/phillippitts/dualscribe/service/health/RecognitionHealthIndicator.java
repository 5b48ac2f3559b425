package com.phillippitts.dualscribe.service.health;

import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.service.orchestration.StreamHealth;
import com.phillippitts.dualscribe.service.orchestration.StreamReconnector;
import com.phillippitts.dualscribe.service.recognition.RecognitionClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.Locale;
import java.util.Map;

/**
 * Health indicator for the recognition streams.
 *
 * <ul>
 *   <li>UP: recognizer available and every stream healthy</li>
 *   <li>DEGRADED: recognizer available, at least one stream reconnecting or disabled</li>
 *   <li>DOWN: recognizer unavailable (model missing, no credentials) or every stream disabled</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
public class RecognitionHealthIndicator implements HealthIndicator {

    private final RecognitionClient client;
    private final StreamReconnector reconnector;

    public RecognitionHealthIndicator(RecognitionClient client, StreamReconnector reconnector) {
        this.client = client;
        this.reconnector = reconnector;
    }

    @Override
    public Health health() {
        boolean available = client.isAvailable();
        Map<StreamId, StreamHealth> streams = reconnector.snapshot();
        long disabled = streams.values().stream().filter(h -> h == StreamHealth.DISABLED).count();
        boolean allHealthy = streams.values().stream().allMatch(h -> h == StreamHealth.HEALTHY);

        Health.Builder builder = new Health.Builder();
        if (!available) {
            builder.down().withDetail("status", "Recognizer unavailable");
        } else if (disabled == streams.size()) {
            builder.down().withDetail("status", "All streams disabled");
        } else if (allHealthy) {
            builder.up().withDetail("status", "All streams operational");
        } else {
            builder.status("DEGRADED").withDetail("status", "Partial stream availability");
        }
        builder.withDetail("recognizer", client.name());
        streams.forEach((id, h) -> builder.withDetail(id.wireName(), h.name().toLowerCase(Locale.ROOT)));
        return builder.build();
    }
}
