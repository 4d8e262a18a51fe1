package com.docweaver.dispatch.cli;

import com.docweaver.core.graph.PipelineGraph;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.Locale;

/**
 * CLI command: docweaver stages
 * <p>
 * Prints the configured pipeline in dependency order.
 */
@Command(name = "stages", mixinStandardHelpOptions = true, description = "List pipeline stages")
@Component
public class StagesCommand implements Runnable {

    private final PipelineGraph graph;

    public StagesCommand(PipelineGraph graph) {
        this.graph = graph;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        System.out.printf("  %-10s %-10s %-9s %-7s %s%n", "STAGE", "ROLE", "REQUIRED", "WEIGHT", "DEPENDS ON");
        System.out.println("  " + "-".repeat(56));
        for (String name : graph.topologicalOrder()) {
            var stage = graph.stage(name);
            System.out.printf(Locale.ROOT, "  %-10s %-10s %-9s %-7.1f %s%n",
                    stage.name(), stage.role().wireName(), stage.required() ? "yes" : "no", stage.weight(),
                    stage.dependsOn().isEmpty() ? "-" : String.join(", ", stage.dependsOn()));
        }
        System.out.printf(Locale.ROOT, "  %-10s %-10s %-9s %-7.1f %s%n",
                "assemble", "-", "yes", graph.assemblyWeight(), "all stages");
    }
}
