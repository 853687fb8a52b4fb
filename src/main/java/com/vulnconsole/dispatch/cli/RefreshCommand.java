package com.vulnconsole.dispatch.cli;

import com.vulnconsole.core.engine.ReconciliationEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: vulnconsole refresh
 */
@Command(name = "refresh", mixinStandardHelpOptions = true,
        description = "Rescan the catalog and query the container runtime")
@Component
public class RefreshCommand implements Runnable {

    private final ReconciliationEngine engine;

    public RefreshCommand(ReconciliationEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        long started = System.currentTimeMillis();
        int count = engine.getEnvironments(true).size();
        ConsoleOutput.success("Indexed " + count + " environments in " + (System.currentTimeMillis() - started) + "ms");
    }
}
