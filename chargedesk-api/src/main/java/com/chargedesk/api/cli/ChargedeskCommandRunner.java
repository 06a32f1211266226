package com.chargedesk.api.cli;

import com.chargedesk.api.generator.CaseRecordGenerator;
import com.chargedesk.api.generator.GenerationSummary;
import com.chargedesk.api.reporting.ReportRenderer;
import com.chargedesk.api.reporting.ReportingService;
import com.chargedesk.api.schema.InitializationReport;
import com.chargedesk.api.schema.SchemaInitializer;
import com.chargedesk.api.schema.SchemaInitializer.StoreOverwriteException;
import com.chargedesk.core.domain.Chargeback.CaseCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Command line entry point: {@code init [--force]}, {@code seed [--seed=<n>]} and {@code report}.
 *
 * Exit codes: 0 on success, 1 when the command failed, 2 on a usage error.
 */
@Component
public class ChargedeskCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ChargedeskCommandRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = """
            Usage: chargedesk <command> [options]

            Commands:
              init [--force]     create the chargeback store; --force replaces an existing one
              seed [--seed=<n>]  replace the store contents with generated case records
              report             print an overview of the store
            """;

    private final SchemaInitializer schemaInitializer;
    private final CaseRecordGenerator generator;
    private final ReportingService reportingService;
    private final ReportRenderer reportRenderer;

    private int exitCode = EXIT_OK;

    public ChargedeskCommandRunner(SchemaInitializer schemaInitializer, CaseRecordGenerator generator,
                                   ReportingService reportingService, ReportRenderer reportRenderer) {
        this.schemaInitializer = schemaInitializer;
        this.generator = generator;
        this.reportingService = reportingService;
        this.reportRenderer = reportRenderer;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.isEmpty()) {
            System.out.print(USAGE);
            return EXIT_OK;
        }
        if (commands.size() > 1) {
            return usageError("Expected one command, got " + commands);
        }
        String command = commands.get(0);
        try {
            return switch (command) {
                case "init" -> init(args.containsOption("force"));
                case "seed" -> seed(args);
                case "report" -> report();
                default -> usageError("Unknown command '" + command + "'");
            };
        } catch (StoreOverwriteException e) {
            log.error("{} Re-run with --force to replace it.", e.getMessage());
            return EXIT_FAILED;
        } catch (RuntimeException e) {
            log.error("Command '{}' failed: {}", command, e.getMessage(), e);
            return EXIT_FAILED;
        }
    }

    private int init(boolean force) {
        InitializationReport report = schemaInitializer.initialize(force);
        System.out.println("Chargeback store initialized (schema version " + report.schemaVersion() + ")");
        for (Map.Entry<String, Long> entry : report.rowCounts().entrySet()) {
            System.out.printf("   %-20s %6d rows%n", entry.getKey(), entry.getValue());
        }
        System.out.println("Indexes: " + String.join(", ", report.indexNames()));
        return EXIT_OK;
    }

    private int seed(ApplicationArguments args) {
        List<String> seeds = args.getOptionValues("seed");
        GenerationSummary summary;
        if (seeds == null) {
            summary = generator.generate();
        } else {
            if (seeds.size() != 1) {
                return usageError("--seed takes exactly one value");
            }
            long seed;
            try {
                seed = Long.parseLong(seeds.get(0));
            } catch (NumberFormatException e) {
                return usageError("--seed must be a whole number, got '" + seeds.get(0) + "'");
            }
            summary = generator.generate(seed);
        }
        System.out.println("Generated case records (seed " + summary.seed() + ")");
        System.out.printf("   %-14s %6d%n", "merchants", summary.merchants());
        System.out.printf("   %-14s %6d%n", "customers", summary.customers());
        System.out.printf("   %-14s %6d%n", "transactions", summary.transactions());
        System.out.printf("   %-14s %6d%n", "chargebacks", summary.chargebacks());
        System.out.printf("   %-14s %6d%n", "case events", summary.events());
        for (CaseCategory category : CaseCategory.values()) {
            System.out.printf("      %-16s %4d%n", category.code(), summary.chargebacksIn(category));
        }
        return EXIT_OK;
    }

    private int report() {
        System.out.print(reportRenderer.render(reportingService.overview()));
        return EXIT_OK;
    }

    private int usageError(String message) {
        log.error(message);
        System.out.print(USAGE);
        return EXIT_USAGE;
    }
}
