package com.powerguard.dispatch.cli;

import com.powerguard.core.model.ActionableType;
import com.powerguard.core.registry.ActionableRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: powerguard types
 */
@Command(name = "types", mixinStandardHelpOptions = true, description = "List supported actionable types")
@Component
public class TypesCommand implements Runnable {

    private final ActionableRegistry registry;

    public TypesCommand(ActionableRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Supported actionable types (" + registry.registeredTypes().size() + "):");
        System.out.println();
        System.out.printf("  %-26s %-20s %-16s %s%n", "TYPE", "DOMAIN", "REQUIRED", "DESCRIPTION");
        System.out.println("  " + "-".repeat(90));
        for (ActionableType type : registry.registeredTypes()) {
            System.out.printf("  %-26s %-20s %-16s %s%n",
                    type.key(), type.domain().name(), String.join(",", registry.requiredFields(type)), type.description());
        }
    }
}
