package com.desweep.dispatch.cli;

import com.desweep.core.model.AnalysisReport;
import com.desweep.core.model.AnalysisSummary;
import com.desweep.core.model.ClassifiedDependency;
import com.desweep.core.model.TypeSummary;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the desweep CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) DESWEEP v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [DESWEEP]|@ " + message));
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

    public static void progress(String stage, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) [" + stage + "]|@ " + message));
    }

    public static void summary(AnalysisReport report) {
        AnalysisSummary s = report.summary();
        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Dependency Analysis|@ (run " + report.runId() + ")"));
        System.out.println("  Entities analysed:     " + s.totalEntities());
        System.out.println("  Dependencies found:    " + s.totalRawDependencies() + " (" + s.uniqueDependencies() + " unique)");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(green) Safe to delete:        " + s.safeToDelete() + "|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(yellow) Requires review:       " + s.requiresReview() + "|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(red) Unknown:               " + s.unknown() + "|@"));

        if (!s.byType().isEmpty()) {
            System.out.println();
            System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold By type|@"));
            s.byType().forEach((type, counts) -> System.out.printf("  %-18s %s%n", type.label(), format(counts)));
        }

        section("Safe to delete", "fg(green)", report.safeToDelete());
        section("Requires review", "fg(yellow)", report.requiresReview());
        section("Unknown", "fg(red)", report.unknown());
    }

    private static void section(String title, String color, List<ClassifiedDependency> dependencies) {
        if (dependencies.isEmpty()) {
            return;
        }
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold," + color + " " + title + "|@"));
        for (ClassifiedDependency d : dependencies) {
            var dep = d.dependency();
            System.out.printf("  [%s] %s (%s)%n", dep.type().label(),
                    dep.name() != null ? dep.name() : dep.id(), dep.detail());
            System.out.println("      " + d.verdict().reason());
        }
    }

    private static String format(TypeSummary counts) {
        return counts.total() + " total, " + counts.safeToDelete() + " safe, "
                + counts.requiresReview() + " review, " + counts.unknown() + " unknown";
    }
}
