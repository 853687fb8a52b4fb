package com.vulnconsole.runtime.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ContainerPort;
import com.github.dockerjava.api.model.Image;
import com.github.dockerjava.api.model.PullResponseItem;
import com.vulnconsole.core.model.ContainerState;
import com.vulnconsole.core.model.EnvironmentStatus;
import com.vulnconsole.core.model.RunningContainer;
import com.vulnconsole.core.scanner.CatalogEntry;
import com.vulnconsole.core.scanner.CatalogScanner;
import com.vulnconsole.core.scanner.ComposeDefinition;
import com.vulnconsole.core.scanner.CompositionParseException;
import com.vulnconsole.runtime.RuntimeOutcome;
import com.vulnconsole.runtime.RuntimeProbe;
import com.vulnconsole.runtime.RuntimeUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * RuntimeProbe backed by the Docker Engine API for queries and the compose CLI
 * for bringing environments up and down.
 *
 * <p>Containers are attributed to environments through the labels compose sets on
 * everything it creates:
 * <ul>
 *   <li>{@code com.docker.compose.project.working_dir}: the environment directory</li>
 *   <li>{@code com.docker.compose.service}: the service name</li>
 * </ul>
 * Listing containers and images is one Engine API call each, whatever the number
 * of environments asked about.
 *
 * <p>Before {@code compose up} the probe checks whether any running container
 * outside the environment already publishes one of its host ports. This reports
 * the conflicting containers by name instead of relying on compose's error text,
 * which is still classified as a fallback.
 */
public class DockerRuntimeProbe implements RuntimeProbe {

    private static final Logger log = LoggerFactory.getLogger(DockerRuntimeProbe.class);

    static final String WORKING_DIR_LABEL = "com.docker.compose.project.working_dir";
    static final String SERVICE_LABEL = "com.docker.compose.service";

    private static final List<String> PORT_CONFLICT_MARKERS = List.of(
            "port is already allocated",
            "address already in use",
            "ports are not available"
    );

    private static final int ERROR_TAIL_LINES = 5;

    private final DockerClient dockerClient;
    private final ComposeCommandRunner composeRunner;
    private final CatalogScanner scanner;
    private final Path catalogRoot;
    private final int pullTimeoutSeconds;

    public DockerRuntimeProbe(DockerClient dockerClient, ComposeCommandRunner composeRunner,
                              CatalogScanner scanner, Path catalogRoot, int pullTimeoutSeconds) {
        this.dockerClient = dockerClient;
        this.composeRunner = composeRunner;
        this.scanner = scanner;
        this.catalogRoot = catalogRoot.toAbsolutePath().normalize();
        this.pullTimeoutSeconds = pullTimeoutSeconds;
    }

    @Override
    public Map<String, Boolean> imagesPresent(Set<String> imageRefs) {
        var result = new LinkedHashMap<String, Boolean>();
        if (imageRefs.isEmpty()) {
            return result;
        }
        List<Image> images = query("list images", () -> dockerClient.listImagesCmd().exec());

        var local = new HashSet<String>();
        for (Image image : images) {
            addCanonical(local, image.getRepoTags());
            addCanonical(local, image.getRepoDigests());
        }
        for (String ref : imageRefs) {
            result.put(ref, local.contains(canonicalOrSelf(ref)));
        }
        log.debug("{} of {} images present locally",
                result.values().stream().filter(Boolean::booleanValue).count(), result.size());
        return result;
    }

    @Override
    public ContainerState containerState(String environmentId) {
        return containerStates(List.of(environmentId)).get(environmentId);
    }

    @Override
    public Map<String, ContainerState> containerStates(Collection<String> environmentIds) {
        List<Container> containers = query("list containers", () -> dockerClient.listContainersCmd()
                .withLabelFilter(List.of(WORKING_DIR_LABEL))
                .exec());

        var portsById = new LinkedHashMap<String, Map<String, Integer>>();
        for (Container container : containers) {
            Optional<String> owner = environmentOf(container);
            if (owner.isEmpty()) continue;
            Map<String, Integer> services = portsById.computeIfAbsent(owner.get(), k -> new LinkedHashMap<>());
            String service = labelOf(container, SERVICE_LABEL);
            Integer port = firstPublicPort(container);
            if (service != null && port != null) {
                services.putIfAbsent(service, port);
            }
        }

        var states = new LinkedHashMap<String, ContainerState>();
        for (String id : environmentIds) {
            Map<String, Integer> services = portsById.get(id);
            states.put(id, services == null
                    ? ContainerState.stopped()
                    : new ContainerState(EnvironmentStatus.RUNNING, services));
        }
        return states;
    }

    @Override
    public RuntimeOutcome start(String environmentId) {
        Optional<CatalogEntry> entry = scanner.entryFor(catalogRoot, environmentId);
        if (entry.isEmpty()) {
            return RuntimeOutcome.failed("Environment not found: " + environmentId);
        }
        ComposeDefinition compose;
        try {
            compose = scanner.compose(entry.get());
        } catch (CompositionParseException e) {
            return RuntimeOutcome.failed("Cannot parse composition file: " + e.getMessage());
        }

        List<String> conflicting = containersHoldingPorts(compose.hostPorts(), entry.get().directory());
        if (!conflicting.isEmpty()) {
            String message = "Host port already in use by " + String.join(", ", conflicting);
            log.warn("Not starting {}: {}", environmentId, message);
            return RuntimeOutcome.conflict(message, conflicting);
        }

        log.info("Starting {} (compose up)", environmentId);
        ComposeCommandRunner.CommandResult result = composeRunner.compose(
                entry.get().directory(), entry.get().composeFile(), "up", "-d");
        if (result.succeeded()) {
            return RuntimeOutcome.ok();
        }
        String message = tail(result.output());
        if (isPortConflict(result.output())) {
            return RuntimeOutcome.conflict(message, List.of());
        }
        return RuntimeOutcome.failed(message);
    }

    @Override
    public RuntimeOutcome stop(String environmentId) {
        Optional<CatalogEntry> entry = scanner.entryFor(catalogRoot, environmentId);
        if (entry.isEmpty()) {
            return RuntimeOutcome.failed("Environment not found: " + environmentId);
        }
        log.info("Stopping {} (compose down)", environmentId);
        ComposeCommandRunner.CommandResult result = composeRunner.compose(
                entry.get().directory(), entry.get().composeFile(), "down");
        return result.succeeded() ? RuntimeOutcome.ok() : RuntimeOutcome.failed(tail(result.output()));
    }

    @Override
    public boolean pull(String imageRef, Consumer<String> progress) {
        ImageReference ref = ImageReference.parse(imageRef);
        log.info("Pulling {}", ref);
        var errored = new AtomicBoolean();
        var callback = new PullImageResultCallback() {
            @Override
            public void onNext(PullResponseItem item) {
                super.onNext(item);
                if (item.isErrorIndicated()) {
                    errored.set(true);
                }
                String line = describe(item);
                if (line != null) {
                    progress.accept(line);
                }
            }
        };
        try {
            call("pull " + imageRef, () -> dockerClient.pullImageCmd(ref.repository())
                    .withTag(ref.pullTag())
                    .exec(callback));
            if (!callback.awaitCompletion(pullTimeoutSeconds, TimeUnit.SECONDS)) {
                progress.accept("Timed out pulling " + imageRef);
                return false;
            }
            return !errored.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            progress.accept("Interrupted while pulling " + imageRef);
            return false;
        } catch (RuntimeUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            // Errors raised while streaming surface from awaitCompletion
            log.warn("Pull of {} failed: {}", imageRef, e.getMessage());
            progress.accept("Error: " + e.getMessage());
            return false;
        } finally {
            closeQuietly(callback);
        }
    }

    @Override
    public List<RunningContainer> runningContainers() {
        List<Container> containers = call("list containers", () -> dockerClient.listContainersCmd().exec());
        var running = new ArrayList<RunningContainer>();
        for (Container c : containers) {
            String id = c.getId() != null && c.getId().length() > 12 ? c.getId().substring(0, 12) : c.getId();
            running.add(new RunningContainer(id, nameOf(c), c.getImage(), c.getStatus(), renderPorts(c)));
        }
        return running;
    }

    @Override
    public void ping() {
        call("ping", () -> dockerClient.pingCmd().exec());
    }

    private List<String> containersHoldingPorts(List<Integer> hostPorts, Path environmentDir) {
        if (hostPorts.isEmpty()) {
            return List.of();
        }
        List<Container> containers = call("list containers", () -> dockerClient.listContainersCmd().exec());
        var names = new TreeSet<String>();
        for (Container container : containers) {
            String workingDir = labelOf(container, WORKING_DIR_LABEL);
            if (workingDir != null && Path.of(workingDir).normalize().equals(environmentDir.normalize())) {
                // Our own containers; compose up on a running environment is a no-op
                continue;
            }
            for (ContainerPort port : portsOf(container)) {
                if (port.getPublicPort() != null && hostPorts.contains(port.getPublicPort())) {
                    names.add(nameOf(container));
                }
            }
        }
        return new ArrayList<>(names);
    }

    static boolean isPortConflict(String output) {
        if (output == null) return false;
        String lower = output.toLowerCase(Locale.ROOT);
        return PORT_CONFLICT_MARKERS.stream().anyMatch(lower::contains);
    }

    private Optional<String> environmentOf(Container container) {
        String workingDir = labelOf(container, WORKING_DIR_LABEL);
        if (workingDir == null || workingDir.isBlank()) {
            return Optional.empty();
        }
        Path dir = Path.of(workingDir).normalize();
        for (Path root : rootCandidates()) {
            if (dir.startsWith(root)) {
                Path relative = root.relativize(dir);
                if (relative.getNameCount() == 2) {
                    return Optional.of(relative.toString().replace('\\', '/'));
                }
            }
        }
        return Optional.empty();
    }

    private List<Path> rootCandidates() {
        try {
            Path real = catalogRoot.toRealPath();
            return real.equals(catalogRoot) ? List.of(catalogRoot) : List.of(catalogRoot, real);
        } catch (IOException e) {
            return List.of(catalogRoot);
        }
    }

    private static String describe(PullResponseItem item) {
        if (item.getErrorDetail() != null && item.getErrorDetail().getMessage() != null) {
            return "Error: " + item.getErrorDetail().getMessage();
        }
        if (item.getStatus() == null) {
            return null;
        }
        var sb = new StringBuilder();
        if (item.getId() != null) {
            sb.append(item.getId()).append(": ");
        }
        sb.append(item.getStatus());
        if (item.getProgress() != null) {
            sb.append(' ').append(item.getProgress());
        }
        return sb.toString();
    }

    private static void addCanonical(Set<String> into, String[] refs) {
        if (refs == null) return;
        for (String ref : refs) {
            if (ref != null && !ref.startsWith("<none>")) {
                into.add(canonicalOrSelf(ref));
            }
        }
    }

    private static String canonicalOrSelf(String ref) {
        try {
            return ImageReference.parse(ref).canonical();
        } catch (IllegalArgumentException e) {
            return ref;
        }
    }

    private static String labelOf(Container container, String label) {
        Map<String, String> labels = container.getLabels();
        return labels == null ? null : labels.get(label);
    }

    private static Integer firstPublicPort(Container container) {
        for (ContainerPort port : portsOf(container)) {
            if (port.getPublicPort() != null && port.getPublicPort() > 0) {
                return port.getPublicPort();
            }
        }
        return null;
    }

    private static List<ContainerPort> portsOf(Container container) {
        return container.getPorts() == null ? List.of() : List.of(container.getPorts());
    }

    private static String nameOf(Container container) {
        String[] names = container.getNames();
        if (names == null || names.length == 0) {
            return container.getId();
        }
        return names[0].startsWith("/") ? names[0].substring(1) : names[0];
    }

    private static String renderPorts(Container container) {
        return portsOf(container).stream()
                .filter(p -> p.getPublicPort() != null)
                .map(p -> p.getPublicPort() + "->" + p.getPrivatePort() + "/" + p.getType())
                .distinct()
                .collect(Collectors.joining(", "));
    }

    private static String tail(String output) {
        if (output == null || output.isBlank()) {
            return "compose exited with an error";
        }
        List<String> lines = output.strip().lines().toList();
        return String.join("\n", lines.subList(Math.max(0, lines.size() - ERROR_TAIL_LINES), lines.size()));
    }

    private static void closeQuietly(PullImageResultCallback callback) {
        try {
            callback.close();
        } catch (IOException e) {
            log.debug("Closing pull callback failed: {}", e.getMessage());
        }
    }

    /**
     * Runs a state query used to build listings. Any failure, an API error included,
     * reports the runtime as unavailable so callers can degrade instead of failing.
     */
    private static <T> T query(String what, Supplier<T> action) {
        try {
            return call(what, action);
        } catch (DockerException e) {
            throw new RuntimeUnavailableException("Docker daemon error (" + what + "): " + e.getMessage(), e);
        }
    }

    /**
     * Runs one Engine API call. API errors ({@link DockerException}) pass through;
     * anything else means the daemon could not be reached.
     */
    private static <T> T call(String what, Supplier<T> action) {
        try {
            return action.get();
        } catch (DockerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RuntimeUnavailableException("Docker daemon unreachable (" + what + "): " + e.getMessage(), e);
        }
    }
}
