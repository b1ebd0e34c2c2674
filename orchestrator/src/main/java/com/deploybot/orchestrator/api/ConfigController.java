package com.deploybot.orchestrator.api;

import com.deploybot.orchestrator.config.ProjectCatalog;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Set;

/**
 * GET  /config/projects — configured project names
 * POST /config/reload   — re-read config_overrides and swap the project snapshot
 */
@RestController
@RequestMapping("/config")
public class ConfigController {

    private final ProjectCatalog catalog;

    public ConfigController(ProjectCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping("/projects")
    public Set<String> projects() {
        return catalog.projectNames();
    }

    @PostMapping("/reload")
    public Map<String, Object> reload() {
        return Map.of("projects", catalog.reload());
    }
}
