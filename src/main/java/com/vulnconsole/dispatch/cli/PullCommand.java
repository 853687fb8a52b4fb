package com.vulnconsole.dispatch.cli;

import com.vulnconsole.core.engine.ReconciliationEngine;
import com.vulnconsole.core.events.ConsoleEvent;
import com.vulnconsole.core.events.EventBus;
import com.vulnconsole.core.operations.OperationResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

/**
 * CLI command: vulnconsole pull &lt;category/environment&gt;
 * <p>
 * Pulls the environment's missing images and prints progress until the pull ends.
 */
@Command(name = "pull", mixinStandardHelpOptions = true, description = "Pull an environment's missing images")
@Component
public class PullCommand implements Runnable {

    @Parameters(index = "0", description = "Environment id, e.g. nginx/CVE-2021-23017")
    private String environmentId;

    private final ReconciliationEngine engine;
    private final EventBus eventBus;

    public PullCommand(ReconciliationEngine engine, EventBus eventBus) {
        this.engine = engine;
        this.eventBus = eventBus;
    }

    @Override
    public void run() {
        var done = new CountDownLatch(1);
        var terminal = new AtomicReference<ConsoleEvent>();
        EventBus.Subscription subscription = eventBus.subscribe(environmentId, event -> {
            if (ConsoleEvent.PULL_LOG.equals(event.eventType())) {
                ConsoleOutput.progress(String.valueOf(event.payload().get("line")));
            } else if (event.isTerminal()) {
                terminal.set(event);
                done.countDown();
            }
        });
        try {
            OperationResult result = engine.pullImages(environmentId);
            if (result.kind() != OperationResult.Kind.ACCEPTED) {
                ConsoleOutput.operationResult(result);
                return;
            }
            ConsoleOutput.info("Pulling images for " + environmentId + "...");
            done.await();
            ConsoleEvent end = terminal.get();
            if (ConsoleEvent.OPERATION_COMPLETED.equals(end.eventType())) {
                ConsoleOutput.success("Images for " + environmentId + " are present");
            } else {
                ConsoleOutput.error("Pull failed: " + end.payload().get("message"));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted while waiting for the pull to finish");
        } finally {
            subscription.unsubscribe();
        }
    }
}
