package com.vulnconsole.dispatch.api;

import com.vulnconsole.core.engine.ReconciliationEngine;
import com.vulnconsole.core.model.CatalogStats;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for catalog statistics.
 */
@RestController
@RequestMapping("/api/v1/stats")
public class StatsController {

    private final ReconciliationEngine engine;

    public StatsController(ReconciliationEngine engine) {
        this.engine = engine;
    }

    @GetMapping
    public CatalogStats stats() {
        return engine.stats();
    }
}
