package com.vulnconsole.runtime;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import com.vulnconsole.core.ConsoleProperties;
import com.vulnconsole.core.scanner.CatalogScanner;
import com.vulnconsole.runtime.docker.ComposeCommandRunner;
import com.vulnconsole.runtime.docker.DockerRuntimeProbe;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class RuntimeConfig {

    @Bean
    public DockerClient dockerClient(ConsoleProperties properties) {
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(properties.getDockerHost())
                .build();
        // ZerodepDockerHttpClient has built-in Unix socket support
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .connectionTimeout(Duration.ofSeconds(5))
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    public ComposeCommandRunner composeCommandRunner(ConsoleProperties properties) {
        return new ComposeCommandRunner(properties.getComposeCommand(), properties.getCommandTimeoutSeconds());
    }

    @Bean
    public RuntimeProbe dockerRuntimeProbe(DockerClient dockerClient, ComposeCommandRunner composeRunner,
                                           CatalogScanner scanner, ConsoleProperties properties) {
        return new DockerRuntimeProbe(dockerClient, composeRunner, scanner,
                properties.getCatalogRoot(), properties.getPullTimeoutSeconds());
    }
}
