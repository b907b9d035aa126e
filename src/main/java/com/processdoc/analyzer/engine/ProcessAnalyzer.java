package com.processdoc.analyzer.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.processdoc.analyzer.describe.StepContext;
import com.processdoc.analyzer.describe.StepDescriptorSynthesizer;
import com.processdoc.analyzer.model.AnalysisDiagnostics;
import com.processdoc.analyzer.model.DescriptionMode;
import com.processdoc.analyzer.model.ExecutionModel;
import com.processdoc.analyzer.model.ExecutionNode;
import com.processdoc.analyzer.model.input.StepRecord;

/**
 * Turns flat step records into an {@link ExecutionModel}.
 *
 * Passes, in order:
 * <ol>
 *   <li>normalize records into a sequence-ordered forest</li>
 *   <li>collect tables, variables and step outputs from the flat list</li>
 *   <li>index variable usages across all steps</li>
 *   <li>walk the forest depth first, describing every kept step</li>
 * </ol>
 *
 * Each call works on its own registry, so an instance may be shared between threads.
 */
public class ProcessAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ProcessAnalyzer.class);

    private final StepNormalizer normalizer;
    private final RegistryBuilder registryBuilder;
    private final UsageIndexer usageIndexer;
    private final StepDescriptorSynthesizer synthesizer;

    public ProcessAnalyzer() {
        this(new StepNormalizer(), new RegistryBuilder(), new UsageIndexer(), new StepDescriptorSynthesizer());
    }

    public ProcessAnalyzer(StepNormalizer normalizer, RegistryBuilder registryBuilder,
                           UsageIndexer usageIndexer, StepDescriptorSynthesizer synthesizer) {
        this.normalizer = normalizer;
        this.registryBuilder = registryBuilder;
        this.usageIndexer = usageIndexer;
        this.synthesizer = synthesizer;
    }

    public ExecutionModel analyze(List<StepRecord> records, DescriptionMode mode) {
        return analyze(records, mode, new AnalysisDiagnostics());
    }

    /**
     * Analyzes the records, adding anything noteworthy to the given diagnostics.
     *
     * @throws com.processdoc.analyzer.engine.exception.StepCycleException if parent links form a loop
     */
    public ExecutionModel analyze(List<StepRecord> records, DescriptionMode mode, AnalysisDiagnostics diagnostics) {
        DescriptionMode effectiveMode = DescriptionMode.orDefault(mode);
        log.debug("Analyzing {} steps in {} mode", records.size(), effectiveMode);

        List<StepTreeNode> roots = normalizer.normalize(records, diagnostics);

        ProcessRegistry registry = new ProcessRegistry();
        registryBuilder.collect(records, registry);
        usageIndexer.index(records, registry);

        List<ExecutionNode> tree = new ArrayList<>();
        List<ExecutionNode> flow = new ArrayList<>();
        for (StepTreeNode root : roots) {
            ExecutionNode node = visit(root, 0, effectiveMode, registry, flow);
            if (node != null) {
                tree.add(node);
            }
        }
        log.debug("Kept {} of {} steps", flow.size(), records.size());

        return ExecutionModel.builder()
                .mode(effectiveMode)
                .executionTree(Collections.unmodifiableList(tree))
                .executionFlow(Collections.unmodifiableList(flow))
                .variables(Collections.unmodifiableList(registry.getVariables()))
                .variableSet(Collections.unmodifiableSet(new LinkedHashSet<>(registry.getVariableNames())))
                .tableSet(Collections.unmodifiableSet(new LinkedHashSet<>(registry.getTableNames())))
                .stepOutputSet(Collections.unmodifiableSet(new LinkedHashSet<>(registry.getStepOutputs())))
                .diagnostics(diagnostics)
                .build();
    }

    /**
     * Describes one step and, unless it is filtered out, its subtree. The node is appended to the
     * flow before its children.
     */
    private ExecutionNode visit(StepTreeNode treeNode, int depth, DescriptionMode mode,
                                ProcessRegistry registry, List<ExecutionNode> flow) {
        StepContext step = new StepContext(treeNode, mode, registry);
        // column origins come from active steps, including those hidden from business readers
        if (step.isActive()) {
            registryBuilder.registerColumns(step.getRecord(), step.getType(), registry);
        }
        if (!synthesizer.isIncluded(step)) {
            log.debug("Skipping step {} ({}) in {} mode", step.getName(), step.getRawType(), mode);
            return null;
        }

        ExecutionNode node = synthesizer.describe(step, depth);
        flow.add(node);
        for (StepTreeNode child : treeNode.getChildren()) {
            ExecutionNode childNode = visit(child, depth + 1, mode, registry, flow);
            if (childNode != null) {
                node.addChild(childNode);
            }
        }
        return node;
    }
}
