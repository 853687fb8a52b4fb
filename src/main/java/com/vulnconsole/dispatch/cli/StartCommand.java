package com.vulnconsole.dispatch.cli;

import com.vulnconsole.core.engine.ReconciliationEngine;
import com.vulnconsole.core.operations.OperationResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: vulnconsole start &lt;category/environment&gt;
 */
@Command(name = "start", mixinStandardHelpOptions = true, description = "Start an environment")
@Component
public class StartCommand implements Runnable {

    @Parameters(index = "0", description = "Environment id, e.g. nginx/CVE-2021-23017")
    private String environmentId;

    private final ReconciliationEngine engine;

    public StartCommand(ReconciliationEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.info("Starting " + environmentId + "...");
        OperationResult result = engine.start(environmentId);
        ConsoleOutput.operationResult(result);
        if (result.kind() == OperationResult.Kind.SUCCESS && result.environment() != null) {
            Integer port = result.environment().primaryPort();
            if (port != null) {
                ConsoleOutput.info("Available at http://localhost:" + port);
            }
        }
    }
}
