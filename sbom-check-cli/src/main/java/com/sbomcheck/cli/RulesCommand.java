package com.sbomcheck.cli;

import com.sbomcheck.core.completeness.CompletenessRuleEngine;
import com.sbomcheck.core.completeness.CompletenessStage;
import com.sbomcheck.core.config.CheckConfig;
import com.sbomcheck.core.config.ConfigLoader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to list the completeness rule stages in execution order.
 */
@Command(
    name = "rules",
    description = "List completeness rule stages in execution order",
    mixinStandardHelpOptions = true
)
public class RulesCommand implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: sbomcheck.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        CheckConfig config = ConfigLoader.load(configPath);
        CompletenessRuleEngine engine = CompletenessRuleEngine.withSpdxVersions(config.effectiveSpdxVersions());

        System.out.println("Completeness Stages:");
        System.out.println();

        int position = 1;
        for (CompletenessStage stage : engine.stages()) {
            System.out.printf("  %d. %s (ID: %s)%n", position++, stage.getDisplayName(), stage.getId());
        }

        System.out.println();
        System.out.println("Accepted SPDX versions: " + config.effectiveSpdxVersions());
        return 0;
    }
}
