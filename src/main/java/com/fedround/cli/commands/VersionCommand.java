package com.fedround.cli.commands;

import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Shows version information about FedRound and its components.
 */
@Command(name = "version", description = "Show version information")
public class VersionCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println("FedRound - Round-based Federated Training");
        System.out.println();
        System.out.println("Version: 1.0-SNAPSHOT");
        System.out.println("Java: " + System.getProperty("java.version"));
        System.out.println("OS: " + System.getProperty("os.name") + " " + System.getProperty("os.version"));
        System.out.println();
        System.out.println("Components:");
        System.out.println("  - Transport: Java RMI");
        System.out.println("  - Aggregation: weighted federated averaging");
        System.out.println("  - Local model: softmax regression");
        System.out.println("  - CLI: Picocli 4.7.5");
        System.out.println("  - Logging: SLF4J + Logback");
        System.out.println();
        return 0;
    }
}
