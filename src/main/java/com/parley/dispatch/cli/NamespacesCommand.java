package com.parley.dispatch.cli;

import com.parley.core.store.NamespaceRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: parley namespaces
 */
@Command(name = "namespaces", mixinStandardHelpOptions = true, description = "List registered namespaces")
@Component
public class NamespacesCommand implements Runnable {

    private final NamespaceRegistry namespaces;

    public NamespacesCommand(NamespaceRegistry namespaces) {
        this.namespaces = namespaces;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var registered = namespaces.all();
        if (registered.isEmpty()) {
            ConsoleOutput.info("No namespaces registered.");
            return;
        }

        System.out.printf("  %-16s %-20s %-12s %s%n", "FOLDER", "NAME", "TRIGGER", "CONVERSATION");
        System.out.println("  " + "-".repeat(76));
        registered.forEach((conversationKey, ns) -> {
            String folder = namespaces.isPrivileged(ns.folder()) ? ns.folder() + " *" : ns.folder();
            System.out.printf("  %-16s %-20s %-12s %s%n", folder, TasksCommand.truncate(ns.name(), 20),
                    ns.trigger(), conversationKey);
        });
        System.out.println();
        ConsoleOutput.info("* privileged namespace");
    }
}
