package com.vulnconsole.core.health;

import com.vulnconsole.runtime.RuntimeProbe;
import com.vulnconsole.runtime.RuntimeUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HealthCheckServiceTest {

    @TempDir
    Path tmp;

    private HealthCheckService service(RuntimeProbe probe) {
        return new HealthCheckService(tmp.resolve("vulhub"), tmp.resolve("cache/environments.json"), probe);
    }

    @Nested
    @DisplayName("catalog")
    class CatalogTests {

        @Test
        @DisplayName("UP when the catalog root is a readable directory")
        void up() throws IOException {
            Files.createDirectories(tmp.resolve("vulhub"));

            HealthStatus status = service(mock(RuntimeProbe.class)).checkCatalog();

            assertEquals(HealthStatus.Status.UP, status.status());
            assertEquals(tmp.resolve("vulhub").toString(), status.metadata().get("path"));
        }

        @Test
        @DisplayName("DOWN when the catalog root is missing")
        void missing() {
            assertEquals(HealthStatus.Status.DOWN, service(mock(RuntimeProbe.class)).checkCatalog().status());
        }
    }

    @Nested
    @DisplayName("cache")
    class CacheTests {

        @Test
        @DisplayName("DEGRADED before the first listing writes the cache")
        void noCacheYet() {
            assertEquals(HealthStatus.Status.DEGRADED, service(null).checkCache().status());
        }

        @Test
        @DisplayName("UP once the cache file exists")
        void present() throws IOException {
            Files.createDirectories(tmp.resolve("cache"));
            Files.writeString(tmp.resolve("cache/environments.json"), "{}");

            assertEquals(HealthStatus.Status.UP, service(null).checkCache().status());
        }
    }

    @Nested
    @DisplayName("runtime")
    class RuntimeTests {

        @Test
        @DisplayName("UP when the runtime answers a ping")
        void up() {
            RuntimeProbe probe = mock(RuntimeProbe.class);

            assertEquals(HealthStatus.Status.UP, service(probe).checkRuntime().status());
            verify(probe).ping();
        }

        @Test
        @DisplayName("DOWN with the runtime's message when the ping fails")
        void down() {
            RuntimeProbe probe = mock(RuntimeProbe.class);
            doThrow(new RuntimeUnavailableException("daemon not running")).when(probe).ping();

            HealthStatus status = service(probe).checkRuntime();

            assertEquals(HealthStatus.Status.DOWN, status.status());
            assertTrue(status.detail().contains("daemon not running"));
        }

        @Test
        @DisplayName("DOWN when no runtime is configured")
        void missingProbe() {
            assertEquals(HealthStatus.Status.DOWN, service(null).checkRuntime().status());
        }

        @Test
        @DisplayName("the actuator indicator mirrors the runtime check")
        void actuatorIndicator() {
            RuntimeProbe probe = mock(RuntimeProbe.class);
            doThrow(new RuntimeUnavailableException("daemon not running")).when(probe).ping();

            Health health = new RuntimeHealthIndicator(service(probe)).health();

            assertEquals(Status.DOWN, health.getStatus());
        }
    }

    @Test
    @DisplayName("checkAll reports every component in a fixed order")
    void checkAll() {
        List<HealthStatus> all = service(mock(RuntimeProbe.class)).checkAll();

        assertEquals(List.of("catalog", "cache", "runtime"), all.stream().map(HealthStatus::component).toList());
    }
}
