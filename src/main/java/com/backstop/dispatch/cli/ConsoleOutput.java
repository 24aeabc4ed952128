package com.backstop.dispatch.cli;

import com.backstop.core.health.SystemTier;
import com.backstop.core.model.HealthBucket;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Backstop CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) BACKSTOP v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [BACKSTOP]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void tier(SystemTier tier, double healthPercentage) {
        String color = switch (tier) {
            case NORMAL -> "fg(green)";
            case DEGRADED -> "fg(yellow)";
            case EMERGENCY, CRITICAL -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold," + color + " [" + tier + "]|@ health " + String.format("%.1f", healthPercentage) + "%"));
    }

    public static void component(String componentId, HealthBucket bucket) {
        String color = switch (bucket) {
            case NORMAL -> "fg(green)";
            case DEGRADED -> "fg(yellow)";
            case NEAR_FAILED, FAILED -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + String.format("%-12s", bucket) + "|@ " + componentId));
    }

    public static void missing(String kind, Iterable<String> names) {
        for (String name : names) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) -|@ " + kind + " " + name));
        }
    }

    public static void separator() {
        System.out.println("──────────────────────────────────");
    }
}
