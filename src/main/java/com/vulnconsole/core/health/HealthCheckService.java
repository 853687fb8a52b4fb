package com.vulnconsole.core.health;

import com.vulnconsole.core.ConsoleProperties;
import com.vulnconsole.runtime.RuntimeProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final Path catalogRoot;
    private final Path cacheFile;
    private final RuntimeProbe runtimeProbe;

    @Autowired
    public HealthCheckService(ConsoleProperties properties,
                              @Autowired(required = false) RuntimeProbe runtimeProbe) {
        this(properties.getCatalogRoot(), properties.getCacheFile(), runtimeProbe);
    }

    HealthCheckService(Path catalogRoot, Path cacheFile, RuntimeProbe runtimeProbe) {
        this.catalogRoot = catalogRoot;
        this.cacheFile = cacheFile;
        this.runtimeProbe = runtimeProbe;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkCatalog());
        results.add(checkCache());
        results.add(checkRuntime());
        return results;
    }

    HealthStatus checkCatalog() {
        if (Files.isDirectory(catalogRoot) && Files.isReadable(catalogRoot)) {
            return new HealthStatus("catalog", HealthStatus.Status.UP,
                    "Catalog root readable", Map.of("path", catalogRoot.toString()));
        }
        return new HealthStatus("catalog", HealthStatus.Status.DOWN,
                "Catalog root missing or unreadable", Map.of("path", catalogRoot.toString()));
    }

    HealthStatus checkCache() {
        Map<String, String> meta = Map.of("path", cacheFile.toString());
        if (Files.isRegularFile(cacheFile)) {
            return new HealthStatus("cache", HealthStatus.Status.UP, "Cache file present", meta);
        }
        Path parent = cacheFile.toAbsolutePath().getParent();
        if (parent == null || !Files.exists(parent) || Files.isWritable(parent)) {
            // Nothing cached yet; the first listing creates it
            return new HealthStatus("cache", HealthStatus.Status.DEGRADED, "No cache yet, next listing rescans", meta);
        }
        return new HealthStatus("cache", HealthStatus.Status.DOWN, "Cache directory not writable", meta);
    }

    HealthStatus checkRuntime() {
        if (runtimeProbe == null) {
            return new HealthStatus("runtime", HealthStatus.Status.DOWN,
                    "No container runtime configured", Map.of());
        }
        try {
            runtimeProbe.ping();
            return new HealthStatus("runtime", HealthStatus.Status.UP,
                    "Container runtime reachable", Map.of());
        } catch (RuntimeException e) {
            log.warn("Container runtime health check failed: {}", e.getMessage());
            return new HealthStatus("runtime", HealthStatus.Status.DOWN,
                    "Runtime error: " + e.getMessage(), Map.of());
        }
    }
}
