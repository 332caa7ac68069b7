package com.example.oncall.common;

import com.example.oncall.config.OnCallSettings;
import org.springframework.core.io.ResourceLoader;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    private final OnCallSettings settings;
    private final ResourceLoader resourceLoader;

    public HealthController(OnCallSettings settings, ResourceLoader resourceLoader) {
        this.settings = settings;
        this.resourceLoader = resourceLoader;
    }

    // UP as long as the process serves requests; teamFile reports whether a run could start
    @GetMapping("/api/health")
    public ResponseEntity<ApiResponse<Map<String, Object>>> health() {
        boolean teamFileFound = resourceLoader.getResource(settings.getTeamFile()).exists();
        return ResponseEntity.ok(ApiResponse.success("OK", Map.of(
                "status", "UP",
                "teamFile", teamFileFound ? "FOUND" : "MISSING")));
    }
}
