package com.vulnconsole.core;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "vulnconsole")
public class ConsoleProperties {

    private Catalog catalog = new Catalog();
    private Cache cache = new Cache();
    private ContainerRuntime runtime = new ContainerRuntime();

    // -- Flattened accessors (delegate to nested) --
    public Path getCatalogRoot() { return Path.of(catalog.root).toAbsolutePath().normalize(); }
    public int getMaxScreenshots() { return catalog.maxScreenshots; }
    public Path getCacheFile() {
        if (cache.file == null || cache.file.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".vulnconsole", "catalog-cache.json");
        }
        return Path.of(cache.file).toAbsolutePath().normalize();
    }
    public Duration getCacheTtl() { return cache.ttl; }
    public Duration getFingerprintCheckInterval() { return cache.fingerprintCheckInterval; }
    public String getDockerHost() { return runtime.dockerHost; }
    public String getComposeCommand() { return runtime.composeCommand; }
    public int getCommandTimeoutSeconds() { return runtime.commandTimeoutSeconds; }
    public int getPullTimeoutSeconds() { return runtime.pullTimeoutSeconds; }

    public Catalog getCatalog() { return catalog; }
    public void setCatalog(Catalog catalog) { this.catalog = catalog; }
    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }
    public ContainerRuntime getRuntime() { return runtime; }
    public void setRuntime(ContainerRuntime runtime) { this.runtime = runtime; }

    public static class Catalog {
        private String root = "./vulhub";
        private int maxScreenshots = 3;

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
        public int getMaxScreenshots() { return maxScreenshots; }
        public void setMaxScreenshots(int maxScreenshots) { this.maxScreenshots = maxScreenshots; }
    }

    public static class Cache {
        private String file = "";
        private Duration ttl = Duration.ofHours(24);
        private Duration fingerprintCheckInterval = Duration.ofSeconds(15);

        public String getFile() { return file; }
        public void setFile(String file) { this.file = file; }
        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }
        public Duration getFingerprintCheckInterval() { return fingerprintCheckInterval; }
        public void setFingerprintCheckInterval(Duration fingerprintCheckInterval) {
            this.fingerprintCheckInterval = fingerprintCheckInterval;
        }
    }

    public static class ContainerRuntime {
        private String dockerHost = "unix:///var/run/docker.sock";
        /** Empty means auto-detect ("docker compose", then "docker-compose"). */
        private String composeCommand = "";
        private int commandTimeoutSeconds = 300;
        private int pullTimeoutSeconds = 1800;

        public String getDockerHost() { return dockerHost; }
        public void setDockerHost(String dockerHost) { this.dockerHost = dockerHost; }
        public String getComposeCommand() { return composeCommand; }
        public void setComposeCommand(String composeCommand) { this.composeCommand = composeCommand; }
        public int getCommandTimeoutSeconds() { return commandTimeoutSeconds; }
        public void setCommandTimeoutSeconds(int commandTimeoutSeconds) { this.commandTimeoutSeconds = commandTimeoutSeconds; }
        public int getPullTimeoutSeconds() { return pullTimeoutSeconds; }
        public void setPullTimeoutSeconds(int pullTimeoutSeconds) { this.pullTimeoutSeconds = pullTimeoutSeconds; }
    }
}
