package com.vulnconsole.dispatch.cli;

import com.vulnconsole.core.engine.ReconciliationEngine;
import com.vulnconsole.core.operations.OperationResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: vulnconsole stop &lt;category/environment&gt;
 */
@Command(name = "stop", mixinStandardHelpOptions = true, description = "Stop an environment")
@Component
public class StopCommand implements Runnable {

    @Parameters(index = "0", description = "Environment id, e.g. nginx/CVE-2021-23017")
    private String environmentId;

    private final ReconciliationEngine engine;

    public StopCommand(ReconciliationEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.info("Stopping " + environmentId + "...");
        OperationResult result = engine.stop(environmentId);
        ConsoleOutput.operationResult(result);
    }
}
