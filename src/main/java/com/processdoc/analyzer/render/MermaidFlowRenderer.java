package com.processdoc.analyzer.render;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.processdoc.analyzer.model.DescriptionMode;
import com.processdoc.analyzer.model.ExecutionModel;
import com.processdoc.analyzer.model.ExecutionNode;
import com.processdoc.analyzer.model.StepType;

/**
 * Renders the execution tree as Mermaid flowchart source.
 *
 * Steps are chained in execution order. Groups (and, in technical mode, loops) become
 * subgraphs; a decision fans out to the first step of each branch, labelling the edge with the
 * branch condition. Empty branches end in an "End" node. In business mode, calculated columns
 * and variables without a description are left out of the chain.
 */
public class MermaidFlowRenderer extends TemplateRenderer {
    private static final Logger log = LoggerFactory.getLogger(MermaidFlowRenderer.class);

    static final String TEMPLATE_NAME = "flow.ftl";
    static final int MAX_LABEL_LENGTH = 80;
    static final String FILTER_MARKER = "🌪️ ";

    public void render(ExecutionModel model, Writer writer) throws IOException {
        FlowChart chart = build(model);
        process(TEMPLATE_NAME, Map.of("chart", chart), writer);
        log.debug("Rendered flowchart with {} statements and {} links", chart.getSteps().size(), chart.getLinks().size());
    }

    public String render(ExecutionModel model) {
        StringWriter writer = new StringWriter();
        try {
            render(model, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    public FlowChart build(ExecutionModel model) {
        ChartBuilder builder = new ChartBuilder(model.getMode() == DescriptionMode.TECHNICAL);
        builder.traverse(model.getExecutionTree(), null, null);
        return new FlowChart(List.copyOf(builder.styles), List.copyOf(builder.steps), List.copyOf(builder.links));
    }

    /**
     * Label text safe inside a quoted Mermaid label.
     */
    static String escapeLabel(String label) {
        String cleaned = label.replaceAll("[\"()]", "");
        return cleaned.length() > MAX_LABEL_LENGTH ? cleaned.substring(0, MAX_LABEL_LENGTH) : cleaned;
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate;
            }
        }
        return "";
    }

    private static final class ChartBuilder {
        private final boolean technical;
        private final Map<ExecutionNode, String> nodeIds = new IdentityHashMap<>();
        private final List<String> styles = new ArrayList<>();
        private final List<String> steps = new ArrayList<>();
        private final Set<String> links = new LinkedHashSet<>();
        private int nextId;

        ChartBuilder(boolean technical) {
            this.technical = technical;
        }

        private String idOf(ExecutionNode node) {
            return nodeIds.computeIfAbsent(node, n -> "N" + nextId++);
        }

        /**
         * Chains the nodes after {@code parentId} and returns the id of the last one drawn.
         * {@code incomingLabel} labels the first edge leaving {@code parentId}.
         */
        String traverse(List<ExecutionNode> items, String parentId, String incomingLabel) {
            String previousId = parentId;
            String currentLabel = incomingLabel;

            for (ExecutionNode item : items) {
                StepType type = item.getType();

                if (type == StepType.GROUP || (technical && type == StepType.LOOP)) {
                    String subgraph = idOf(item) + "_sg";
                    steps.add("subgraph " + subgraph + " [\"" + item.getRawType() + ": " + item.getName() + "\"]");
                    styles.add(subgraph + " fill:#ffe4e6,stroke:#f43f5e,stroke-dasharray: 5 5");
                    String lastChild = traverse(item.getChildren(), previousId, currentLabel);
                    steps.add("end");
                    if (lastChild != null) {
                        previousId = lastChild;
                        currentLabel = null;
                    }
                    continue;
                }

                if (type == StepType.BRANCH) {
                    branch(item, parentId);
                    continue;
                }

                String id = idOf(item);
                if (!technical && hiddenInBusinessFlow(item)) {
                    continue;
                }
                steps.add(id + shaped(item, label(item)));

                if (previousId != null) {
                    if (previousId.equals(parentId) && currentLabel != null) {
                        links.add(previousId + " -- \"" + currentLabel + "\" --> " + id);
                        currentLabel = null;
                    } else {
                        links.add(previousId + " --> " + id);
                    }
                }
                previousId = id;

                if (!item.getChildren().isEmpty()) {
                    if (type == StepType.DECISION) {
                        traverse(item.getChildren(), id, null);
                    } else {
                        String lastChild = traverse(item.getChildren(), id, null);
                        if (lastChild != null) {
                            previousId = lastChild;
                        }
                    }
                }
            }
            return previousId;
        }

        private void branch(ExecutionNode item, String parentId) {
            String condition = firstNonBlank(item.getFlowLabel(), item.getContext(), "Condition");
            if (condition.startsWith("If ")) {
                condition = condition.substring(3);
            }
            if (!item.getChildren().isEmpty()) {
                traverse(item.getChildren(), parentId, condition);
                return;
            }
            String endId = idOf(item) + "_END";
            steps.add(endId + "((\"End\")):::endNode");
            if (parentId != null) {
                links.add(parentId + " -- \"" + condition + "\" --> " + endId);
            }
        }

        private static boolean hiddenInBusinessFlow(ExecutionNode item) {
            return (item.getType() == StepType.ADD_COLUMN || item.getType() == StepType.CALCULATE_VARIABLE)
                    && (item.getDescription() == null || item.getDescription().isBlank());
        }

        private static String label(ExecutionNode item) {
            String label = escapeLabel(firstNonBlank(item.getFlowLabel(), item.getContext(), item.getName()));
            if (item.getExistsLogic() != null && !item.getExistsLogic().isEmpty()) {
                label = FILTER_MARKER + label;
            }
            return label;
        }

        private static String shaped(ExecutionNode item, String label) {
            return switch (item.getType()) {
                case RUN_DIRECT_QUERY, RUN_TABLE_QUERY, RUN_DATASOURCE_QUERY ->
                        "[(\"" + label.replaceFirst("^Source Table: |^Source: ", "") + "\")]:::source";
                case IMPORT_WAREHOUSE_DATA, EXPORT_TO_EXCEL, SEND_EMAIL -> "([\"" + label + "\"]):::target";
                case SAVE_TEXT, SAVE_TEXT_FILE -> "[/\"" + label + "\"/]:::bigSave";
                case DECISION -> "{\"" + label + "\"}:::decision";
                default -> "[\"" + label + "\"]:::process";
            };
        }
    }
}
