package com.processdoc.analyzer.describe;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.processdoc.analyzer.expression.CriteriaFlattener;
import com.processdoc.analyzer.expression.ExpressionFlattener;
import com.processdoc.analyzer.model.ExecutionNode;
import com.processdoc.analyzer.model.Rule;
import com.processdoc.analyzer.model.StepType;
import com.processdoc.analyzer.model.VariableEntry;
import com.processdoc.analyzer.model.input.StepRecord;
import com.processdoc.analyzer.util.StepText;

/**
 * Produces the annotated {@link ExecutionNode} of a single step.
 *
 * The node is built from the step's own record, its child types (for loops) and the registry
 * of the current run. Children are not attached here; the caller walks the tree.
 */
public class StepDescriptorSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(StepDescriptorSynthesizer.class);

    static final String DISABLED_SUFFIX = " [DISABLED]";
    static final int USAGES_SHOWN = 3;

    private final ExpressionFlattener expressionFlattener;
    private final ContextSentences sentences;
    private final FlowLabels flowLabels;
    private final StepDetailsCollector detailsCollector;
    private final TableProjectionBuilder tableBuilder;
    private final StepIoResolver ioResolver;

    public StepDescriptorSynthesizer() {
        this(new ExpressionFlattener(), new CriteriaFlattener());
    }

    public StepDescriptorSynthesizer(ExpressionFlattener expressionFlattener, CriteriaFlattener criteriaFlattener) {
        this.expressionFlattener = expressionFlattener;
        this.sentences = new ContextSentences();
        this.flowLabels = new FlowLabels(sentences);
        this.detailsCollector = new StepDetailsCollector(criteriaFlattener);
        this.tableBuilder = new TableProjectionBuilder(expressionFlattener);
        this.ioResolver = new StepIoResolver();
    }

    /**
     * Business readers do not see inactive or housekeeping steps, except for control-flow steps
     * which always stay. Technical mode keeps everything.
     */
    public boolean isIncluded(StepContext step) {
        if (!step.isBusiness()) {
            return true;
        }
        StepType type = step.getType();
        if (type.isStructural()) {
            return true;
        }
        return step.isActive() && !type.isHousekeeping();
    }

    public ExecutionNode describe(StepContext step, int depth) {
        StepRecord record = step.getRecord();
        String rawType = step.getRawType();
        List<String> filters = detailsCollector.filters(step);

        ExecutionNode node = ExecutionNode.builder()
                .id(StepText.slug(rawType, step.getName()))
                .stepId(record.getStepId())
                .rawType(rawType)
                .type(step.getType())
                .name(step.getName())
                .active(step.isActive())
                .depth(depth)
                .phase(step.isActive() ? rawType : rawType + DISABLED_SUFFIX)
                .context(sentences.sentence(step))
                .flowLabel(flowLabels.label(step))
                .smartDescription(smartDescription(step))
                .description(description(record))
                .inputs(ioResolver.inputs(step))
                .outputs(ioResolver.outputs(step))
                .output(ioResolver.explicitOutput(step))
                .details(detailsCollector.details(step, filters))
                .filters(filters)
                .existsLogic(detailsCollector.existsLogic(step))
                .dataDictionary(detailsCollector.dataDictionary(step))
                .table(tableBuilder.build(step))
                .rules(nodeRules(step))
                .build();
        log.debug("Described step {} ({}) at depth {}", node.getName(), rawType, depth);
        return node;
    }

    private String smartDescription(StepContext step) {
        if (step.getType() == StepType.LOOP) {
            return loopPurpose(step.childTypes());
        }
        if (step.getType().isVariableDefinition()) {
            return step.getRegistry()
                    .findVariable(step.text("VariableName").trim())
                    .map(VariableEntry::getUsages)
                    .filter(usages -> !usages.isEmpty())
                    .map(StepDescriptorSynthesizer::usedIn)
                    .orElse("");
        }
        return "";
    }

    /**
     * Guesses what a loop is for from the kinds of steps it repeats.
     */
    static String loopPurpose(List<StepType> childTypes) {
        if (childTypes.contains(StepType.RUN_DIRECT_QUERY) || childTypes.contains(StepType.RUN_TABLE_QUERY)) {
            return "Fetching detailed data for each item";
        }
        if (childTypes.contains(StepType.IMPORT_WAREHOUSE_DATA)) {
            return "Saving results for each item";
        }
        if (childTypes.contains(StepType.CALCULATE_VARIABLE)) {
            return "Participating in complex calculations";
        }
        return "Processing items in batch";
    }

    static String usedIn(List<String> usages) {
        String shown = String.join(", ", usages.subList(0, Math.min(USAGES_SHOWN, usages.size())));
        return "Used in: " + shown + (usages.size() > USAGES_SHOWN ? "..." : "");
    }

    private List<Rule> nodeRules(StepContext step) {
        String expression;
        if (step.getType().isVariableDefinition()) {
            expression = step.firstText("Expression", "VariableValue");
        } else if (step.getType() == StepType.BRANCH) {
            expression = step.text("Expression");
        } else {
            return null;
        }
        return expressionFlattener.flatten(expression).orElse(null);
    }

    private static String description(StepRecord record) {
        for (String candidate : new String[] {record.getDescription(), record.getNarration(), record.getComments()}) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate;
            }
        }
        return "";
    }
}
