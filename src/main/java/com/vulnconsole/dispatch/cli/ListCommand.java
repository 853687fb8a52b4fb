package com.vulnconsole.dispatch.cli;

import com.vulnconsole.core.engine.ReconciliationEngine;
import com.vulnconsole.core.model.EnvironmentDescriptor;
import com.vulnconsole.core.model.EnvironmentStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Locale;

/**
 * CLI command: vulnconsole list [--refresh] [--category X] [--running]
 */
@Command(name = "list", mixinStandardHelpOptions = true, description = "List environments")
@Component
public class ListCommand implements Runnable {

    @Option(names = {"--refresh", "-r"}, description = "Rescan the catalog instead of using the cache")
    private boolean refresh;

    @Option(names = {"--category", "-c"}, description = "Only show one category")
    private String category;

    @Option(names = {"--running"}, description = "Only show running environments")
    private boolean runningOnly;

    @Option(names = {"--search", "-s"}, description = "Case-insensitive substring match on the id")
    private String search;

    private final ReconciliationEngine engine;

    public ListCommand(ReconciliationEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        List<EnvironmentDescriptor> environments = engine.getEnvironments(refresh);
        String needle = search == null ? null : search.toLowerCase(Locale.ROOT);
        int shown = 0;
        for (EnvironmentDescriptor env : environments) {
            if (category != null && !category.equals(env.category())) continue;
            if (runningOnly && env.status() != EnvironmentStatus.RUNNING) continue;
            if (needle != null && !env.id().toLowerCase(Locale.ROOT).contains(needle)) continue;
            ConsoleOutput.environment(env);
            shown++;
        }
        System.out.println("──────────────────────────────────");
        ConsoleOutput.info(shown + " of " + environments.size() + " environments  (I = images present, E = exploit, ! = parse error)");
    }
}
