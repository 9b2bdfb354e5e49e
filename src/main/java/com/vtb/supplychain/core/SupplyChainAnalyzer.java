package com.vtb.supplychain.core;

import com.vtb.supplychain.config.AnalyzerConfig;
import com.vtb.supplychain.graph.DependencyEdge;
import com.vtb.supplychain.graph.DependencyGraph;
import com.vtb.supplychain.graph.GraphBuilder;
import com.vtb.supplychain.graph.GraphSerializer;
import com.vtb.supplychain.graph.SerializedNode;
import com.vtb.supplychain.models.AnalysisReport;
import com.vtb.supplychain.models.Finding;
import com.vtb.supplychain.models.PackageIdentity;
import com.vtb.supplychain.pipeline.StageDescriptor;
import com.vtb.supplychain.pipeline.StageOrchestrator;
import com.vtb.supplychain.pipeline.StandardPipeline;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Точка входа анализа цепочки поставок:
 * ребра резолвера -> граф -> набор пакетов -> конвейер этапов -> отчет.
 */
@Slf4j
public class SupplyChainAnalyzer {

    private final AnalyzerConfig config;
    private final GraphBuilder graphBuilder;
    private final PackageExtractor packageExtractor;
    private final StageOrchestrator orchestrator;

    public SupplyChainAnalyzer() {
        this(AnalyzerConfig.load());
    }

    public SupplyChainAnalyzer(AnalyzerConfig config) {
        this(config, new StageOrchestrator());
    }

    public SupplyChainAnalyzer(AnalyzerConfig config, StageOrchestrator orchestrator) {
        this.config = Objects.requireNonNull(config, "config");
        this.graphBuilder = new GraphBuilder(config.getGraph().getDepthPolicy());
        this.packageExtractor = new PackageExtractor();
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    }

    public DependencyGraph buildGraph(Iterable<DependencyEdge> edges) {
        return graphBuilder.build(edges);
    }

    public AnalysisReport analyze(Iterable<DependencyEdge> edges,
                                  List<StageDescriptor> pipeline,
                                  Duration globalBudget) {
        return analyze(edges, List.of(), pipeline, globalBudget);
    }

    /**
     * Бюджет берется из конфигурации.
     */
    public AnalysisReport analyze(Iterable<DependencyEdge> edges,
                                  List<Finding> initialFindings,
                                  List<StageDescriptor> pipeline) {
        return analyze(edges, initialFindings, pipeline, StandardPipeline.globalBudget(config));
    }

    public AnalysisReport analyze(Iterable<DependencyEdge> edges,
                                  List<Finding> initialFindings,
                                  List<StageDescriptor> pipeline,
                                  Duration globalBudget) {
        Objects.requireNonNull(pipeline, "pipeline");
        DependencyGraph graph = buildGraph(edges);
        Set<PackageIdentity> packages = packageExtractor.extract(initialFindings, graph);
        log.info("Анализ {} пакетов ({} в графе зависимостей)", packages.size(), graph.packageCount());
        return orchestrator.run(packages, initialFindings, pipeline, globalBudget, graph);
    }

    public List<SerializedNode> serializeGraph(DependencyGraph graph, int maxDepth) {
        return GraphSerializer.serialize(graph, maxDepth);
    }

    public List<SerializedNode> serializeGraph(DependencyGraph graph) {
        return serializeGraph(graph, config.getGraph().getMaxDepth());
    }
}
