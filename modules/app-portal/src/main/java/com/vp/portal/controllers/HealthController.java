package com.vp.portal.controllers;

import com.vp.client.VpClientProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    private final VpClientProperties props;

    public HealthController(VpClientProperties props) {
        this.props = props;
    }

    /** Which optional collaborators are configured. Never echoes keys. */
    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of(
            "googleSearchConfigured", props.hasGoogleSearch(),
            "geminiConfigured", props.hasGemini(),
            "parallelFanout", props.isParallelFanout()
        ));
    }
}
