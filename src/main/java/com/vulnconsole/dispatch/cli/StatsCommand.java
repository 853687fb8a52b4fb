package com.vulnconsole.dispatch.cli;

import com.vulnconsole.core.engine.ReconciliationEngine;
import com.vulnconsole.core.model.CatalogStats;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: vulnconsole stats
 */
@Command(name = "stats", mixinStandardHelpOptions = true, description = "Show catalog statistics")
@Component
public class StatsCommand implements Runnable {

    private final ReconciliationEngine engine;

    public StatsCommand(ReconciliationEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        CatalogStats stats = engine.stats();
        System.out.println("Environments: " + stats.total());
        System.out.println("  running:      " + stats.running());
        System.out.println("  stopped:      " + stats.stopped());
        System.out.println("  unknown:      " + stats.unknown());
        System.out.println("  with exploit: " + stats.withExploit());
        System.out.println("  with images:  " + stats.withImages());
        System.out.println();
        System.out.println("Categories: " + stats.categories().size());
        stats.categories().forEach((name, count) -> System.out.printf("  %-30s %d%n", name, count));
    }
}
