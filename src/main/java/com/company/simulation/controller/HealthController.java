package com.company.simulation.controller;

import com.company.simulation.cache.ProjectDataCache;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.view.RedirectView;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
@Tag(name = "Health", description = "Health check endpoints")
@RequiredArgsConstructor
public class HealthController {

    private final ProjectDataCache projectDataCache;

    @GetMapping("/api/health")
    @Operation(summary = "Health check")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "ok");
        response.put("timestamp", Instant.now());
        response.put("service", "simulation-data-service");
        response.put("activeProject", projectDataCache.getActiveProject().orElse(null));

        return ResponseEntity.ok(response);
    }

    @GetMapping("/")
    @Operation(summary = "Redirect to the project list")
    public RedirectView root() {
        return new RedirectView("/api/projects");
    }
}
