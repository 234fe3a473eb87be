package com.actiongate.api;

import com.actiongate.execution.ExecutedRecordStore;
import com.actiongate.execution.PreparedArtifactStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    private final PreparedArtifactStore preparedStore;
    private final ExecutedRecordStore executedStore;

    public HealthController(PreparedArtifactStore preparedStore, ExecutedRecordStore executedStore) {
        this.preparedStore = preparedStore;
        this.executedStore = executedStore;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of(
            "status", "ok",
            "preparedArtifacts", preparedStore.size(),
            "executedRecords", executedStore.size()
        );
    }
}
