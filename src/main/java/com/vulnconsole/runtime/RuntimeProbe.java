package com.vulnconsole.runtime;

import com.vulnconsole.core.model.ContainerState;
import com.vulnconsole.core.model.RunningContainer;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Abstraction over the container runtime.
 * Implementation: DockerRuntimeProbe (Docker Engine API + compose CLI).
 *
 * <p>Every call may block for a long time and every call is safe to retry:
 * {@link #start} on a running environment and {@link #stop} on a stopped one
 * succeed without side effects. Calls throw {@link RuntimeUnavailableException}
 * when the runtime cannot be reached.
 */
public interface RuntimeProbe {

    /**
     * Checks which of the given image references exist in the local image store.
     * Implementations answer the whole set with a single runtime query.
     */
    Map<String, Boolean> imagesPresent(Set<String> imageRefs);

    /**
     * Returns the container state of one environment.
     */
    ContainerState containerState(String environmentId);

    /**
     * Returns the container state of many environments.
     *
     * <p>The default issues one query per id; implementations that can list all
     * containers at once override this.
     */
    default Map<String, ContainerState> containerStates(Collection<String> environmentIds) {
        var states = new LinkedHashMap<String, ContainerState>();
        for (String id : environmentIds) {
            states.put(id, containerState(id));
        }
        return states;
    }

    /**
     * Brings the environment's containers up in the background.
     * Port conflicts are reported with {@link RuntimeOutcome#portConflict()} set.
     */
    RuntimeOutcome start(String environmentId);

    /**
     * Stops and removes the environment's containers.
     */
    RuntimeOutcome stop(String environmentId);

    /**
     * Pulls one image, handing each progress line to {@code progress} as it arrives.
     *
     * @return {@code true} if the pull completed successfully
     */
    boolean pull(String imageRef, Consumer<String> progress);

    /**
     * Lists every running container on the host.
     */
    List<RunningContainer> runningContainers();

    /**
     * Verifies that the runtime answers at all.
     */
    void ping();
}
