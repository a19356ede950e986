package com.desweep.dispatch.cli;

import com.desweep.core.analysis.AnalysisOptions;
import com.desweep.core.analysis.AnalysisProperties;
import com.desweep.core.analysis.DependencyAnalyzer;
import com.desweep.core.events.AuditEvent;
import com.desweep.core.events.EventBus;
import com.desweep.core.loader.LoadOptions;
import com.desweep.core.loader.LoaderProperties;
import com.desweep.core.model.AnalysisReport;
import com.desweep.core.model.TargetEntity;
import com.desweep.core.platform.PlatformConnectionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: desweep analyze &lt;key[:name[:objectId]]&gt;...
 * <p>
 * Loads platform metadata once, finds every object that references the given data
 * extensions and reports which of those references block deletion.
 */
@Command(name = "analyze", mixinStandardHelpOptions = true,
        description = "Analyse dependencies of data extensions before deletion")
@Component
public class AnalyzeCommand implements Callable<Integer> {

    @Parameters(arity = "0..*", paramLabel = "ENTITY", description = "Data extension as key[:name[:objectId]]")
    private List<String> entities = new ArrayList<>();

    @Option(names = {"--input", "-i"}, description = "JSON file with an array of entities")
    private Path input;

    @Option(names = "--stale-days", description = "Days without a run after which a workflow is stale")
    private Integer staleDays;

    @Option(names = "--refresh", description = "Ignore cached metadata and fetch live")
    private boolean refresh;

    @Option(names = "--no-query-text", description = "Skip loading SQL text of queries")
    private boolean noQueryText;

    @Option(names = "--no-workflow-detail", description = "Skip loading full workflow definitions")
    private boolean noWorkflowDetail;

    @Option(names = "--json", description = "Print the full report as JSON")
    private boolean json;

    private final DependencyAnalyzer analyzer;
    private final AnalysisProperties analysisProperties;
    private final LoaderProperties loaderProperties;
    private final EventBus eventBus;
    private final ObjectMapper objectMapper;

    public AnalyzeCommand(DependencyAnalyzer analyzer, AnalysisProperties analysisProperties,
                          LoaderProperties loaderProperties, EventBus eventBus, ObjectMapper objectMapper) {
        this.analyzer = analyzer;
        this.analysisProperties = analysisProperties;
        this.loaderProperties = loaderProperties;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        if (!json) {
            ConsoleOutput.printBanner();
        }

        List<TargetEntity> targets;
        try {
            targets = collectTargets();
        } catch (IOException | IllegalArgumentException e) {
            ConsoleOutput.error("Invalid input: " + e.getMessage());
            return 2;
        }
        if (targets.isEmpty()) {
            ConsoleOutput.error("No entities given. Pass key[:name[:objectId]] arguments or --input <file>.");
            return 2;
        }

        LoadOptions loadOptions = new LoadOptions(refresh,
                loaderProperties.isIncludeWorkflowDetail() && !noWorkflowDetail,
                loaderProperties.isIncludeQueryText() && !noQueryText,
                json ? null : (stage, current, total, message) -> {
                    if (current == total) {
                        ConsoleOutput.progress(stage, message);
                    }
                });
        int days = staleDays != null ? staleDays : analysisProperties.getStaleDays();

        EventBus.Subscription subscription = json ? null : eventBus.subscribe(AnalyzeCommand::renderProgress);
        AnalysisReport report;
        try {
            report = analyzer.analyze(targets, new AnalysisOptions(days, loadOptions));
        } catch (PlatformConnectionException e) {
            ConsoleOutput.error("Cannot reach the platform: " + e.getMessage());
            return 1;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        if (json) {
            try {
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Cannot render report: " + e.getMessage());
                return 1;
            }
        } else {
            ConsoleOutput.summary(report);
        }
        return 0;
    }

    private static void renderProgress(AuditEvent event) {
        if (AuditEvent.ANALYSIS_PROGRESS.equals(event.eventType())) {
            ConsoleOutput.progress("scan", event.entityKey() + " (" + event.payload().get("current")
                    + "/" + event.payload().get("total") + ")");
        }
    }

    List<TargetEntity> collectTargets() throws IOException {
        List<TargetEntity> targets = new ArrayList<>();
        for (String spec : entities) {
            targets.add(TargetEntity.parse(spec));
        }
        if (input != null) {
            JsonNode root = objectMapper.readTree(input.toFile());
            if (!root.isArray()) {
                throw new IllegalArgumentException(input + " must contain a JSON array");
            }
            for (JsonNode node : root) {
                targets.add(node.isTextual() ? TargetEntity.parse(node.asText()) : fromJson(node));
            }
        }
        return targets;
    }

    private static TargetEntity fromJson(JsonNode node) {
        return new TargetEntity(
                first(node, "primaryKey", "customerKey", "key"),
                first(node, "alternateName", "name"),
                first(node, "opaqueId", "objectId"));
    }

    private static String first(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = node.path(field).asText(null);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
