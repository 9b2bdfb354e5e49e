package com.vtb.supplychain.graph;

import com.vtb.supplychain.models.DependencyGraphSummary;
import com.vtb.supplychain.models.Ecosystem;
import com.vtb.supplychain.models.PackageIdentity;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphBuilderTest {

    private final GraphBuilder builder = new GraphBuilder();

    @Test
    void cycleIsDetectedOnceAndKeptInGraph() {
        DependencyGraph graph = builder.build(List.of(
            DependencyEdge.of("root@1.0.0", "a", "1.0.0"),
            DependencyEdge.of("a@1.0.0", "b", "1.0.0"),
            DependencyEdge.of("b@1.0.0", "a", "1.0.0")));

        assertEquals(3, graph.packageCount());
        assertEquals(1, graph.circularDependencyCount());
        assertEquals(List.of("a@1.0.0", "b@1.0.0", "a@1.0.0"),
            graph.getCircularDependencies().get(0).getCycle());
        assertEquals("Циклическая зависимость: a@1.0.0 -> b@1.0.0 -> a@1.0.0",
            graph.getCircularDependencies().get(0).describe());

        assertEquals(1, graph.getRoots().size());
        GraphNode root = graph.getRoots().get(0);
        assertEquals("root@1.0.0", root.identity());

        GraphNode b = graph.getNode("b@1.0.0");
        assertSame(graph.getNode("a@1.0.0"), b.getDependencies().get("a"),
            "Ребро цикла должно сохраняться как ссылка на существующий узел");
    }

    @Test
    void packageCountIgnoresReferenceMultiplicity() {
        DependencyGraph graph = builder.build(List.of(
            DependencyEdge.of("app@1.0.0", "left", "1.0.0"),
            DependencyEdge.of("app@1.0.0", "right", "2.0.0"),
            DependencyEdge.of("left@1.0.0", "shared", "3.1.0"),
            DependencyEdge.of("right@2.0.0", "shared", "3.1.0")));

        assertEquals(4, graph.packageCount());
        assertEquals(0, graph.circularDependencyCount());
        GraphNode shared = graph.getNode("shared@3.1.0");
        assertSame(shared, graph.getNode("left@1.0.0").getDependencies().get("shared"));
        assertSame(shared, graph.getNode("right@2.0.0").getDependencies().get("shared"));
    }

    @Test
    void firstSeenDepthWinsByDefault() {
        List<DependencyEdge> edges = List.of(
            DependencyEdge.of("app@1", "a", "1"),
            DependencyEdge.of("a@1", "b", "1"),
            DependencyEdge.of("b@1", "c", "1"),
            DependencyEdge.of("app@1", "c", "1"));

        DependencyGraph firstSeen = builder.build(edges);
        assertEquals(DepthPolicy.FIRST_SEEN, firstSeen.getDepthPolicy());
        assertEquals(3, firstSeen.getNode("c@1").getDepth());

        DependencyGraph shallowest = new GraphBuilder(DepthPolicy.SHALLOWEST).build(edges);
        assertEquals(1, shallowest.getNode("c@1").getDepth());
        assertEquals(2, shallowest.getNode("b@1").getDepth());
        assertEquals(0, shallowest.getNode("app@1").getDepth());
    }

    @Test
    void versionConflictIsReportedPerName() {
        DependencyGraph graph = builder.build(List.of(
            DependencyEdge.of("app@1.0.0", "lodash", "4.17.0"),
            DependencyEdge.of("app@1.0.0", "express", "4.18.2"),
            DependencyEdge.of("express@4.18.2", "lodash", "4.17.21")));

        assertEquals(1, graph.versionConflictCount());
        VersionConflict conflict = graph.getVersionConflicts().get(0);
        assertEquals("lodash", conflict.getPackageName());
        assertEquals(List.of("4.17.0", "4.17.21"), conflict.getVersions());
        assertEquals("Конфликт версий 'lodash': 4.17.0, 4.17.21", conflict.describe());
        assertEquals(4, graph.packageCount());
    }

    @Test
    void malformedEdgesAreCountedAndSkipped() {
        DependencyGraph graph = builder.build(Arrays.asList(
            DependencyEdge.of("app@1.0.0", "a", "1.0.0"),
            null,
            DependencyEdge.of(" ", "b", "1.0.0"),
            DependencyEdge.of("app@1.0.0", "", "1.0.0"),
            DependencyEdge.of(null, "c", "1.0.0")));

        assertEquals(4, graph.getMalformedEdgeCount());
        assertEquals(2, graph.packageCount());
    }

    @Test
    void blankChildVersionBecomesUnknown() {
        DependencyGraph graph = builder.build(List.of(
            DependencyEdge.of("app", "left-pad", "  ")));

        assertNotNull(graph.getNode("app@unknown"));
        GraphNode child = graph.getNode("left-pad@unknown");
        assertNotNull(child);
        assertEquals(PackageIdentity.UNKNOWN_VERSION, child.getVersion());
    }

    @Test
    void scopedPackageIdentityIsSplitOnLastAt() {
        assertArrayEquals(new String[] {"@types/node", "20.1.0"}, GraphBuilder.splitIdentity("@types/node@20.1.0"));
        assertArrayEquals(new String[] {"@types/node", "unknown"}, GraphBuilder.splitIdentity("@types/node"));
        assertArrayEquals(new String[] {"requests", "2.31.0"}, GraphBuilder.splitIdentity("requests@2.31.0"));

        DependencyGraph graph = builder.build(List.of(
            new DependencyEdge("@scope/app@0.1.0", "@scope/util", "0.2.0", Ecosystem.NPM)));
        GraphNode root = graph.getRoots().get(0);
        assertEquals("@scope/app", root.getName());
        assertEquals("0.1.0", root.getVersion());
    }

    @Test
    void componentMadeOnlyOfCyclesGetsRoot() {
        DependencyGraph graph = builder.build(List.of(
            DependencyEdge.of("app@1", "lib", "1"),
            DependencyEdge.of("x@1", "y", "1"),
            DependencyEdge.of("y@1", "x", "1")));

        assertEquals(4, graph.packageCount());
        assertEquals(2, graph.getRoots().size());
        assertEquals("x@1", graph.getRoots().get(1).identity());
        assertEquals(1, graph.circularDependencyCount());
    }

    @Test
    void duplicateEdgesAreIgnored() {
        DependencyGraph graph = builder.build(List.of(
            DependencyEdge.of("app@1", "a", "1"),
            DependencyEdge.of("app@1", "a", "1")));

        assertEquals(2, graph.packageCount());
        assertEquals(1, graph.getNode("app@1").getDependencies().size());
    }

    @Test
    void sameChildNameWithAnotherVersionKeepsFirstLink() {
        DependencyGraph graph = builder.build(List.of(
            DependencyEdge.of("app@1", "a", "1"),
            DependencyEdge.of("app@1", "a", "2")));

        GraphNode app = graph.getNode("app@1");
        assertEquals(1, app.getDependencies().size());
        assertEquals("1", app.getDependencies().get("a").getVersion());
        assertEquals(1, graph.versionConflictCount());
    }

    @Test
    void nullOrEmptyInputBuildsEmptyGraph() {
        assertTrue(builder.build(null).isEmpty());
        DependencyGraph graph = builder.build(List.of());
        assertTrue(graph.isEmpty());
        assertEquals(DependencyGraphSummary.empty(), graph.summary());
    }

    @Test
    void summaryAndDominantEcosystem() {
        DependencyGraph graph = builder.build(List.of(
            new DependencyEdge("web@1.0.0", "react", "18.2.0", Ecosystem.NPM),
            new DependencyEdge("web@1.0.0", "lodash", "4.17.21", Ecosystem.NPM),
            new DependencyEdge("tools@0.1", "requests", "2.31.0", Ecosystem.PYPI)));

        assertEquals(Ecosystem.NPM, graph.dominantEcosystem());
        DependencyGraphSummary summary = graph.summary();
        assertEquals(5, summary.getPackageCount());
        assertEquals(0, summary.getCircularDependencyCount());
        assertEquals(0, summary.getMalformedEdgeCount());
        assertEquals(5, graph.packages().size());
        assertEquals("web@1.0.0", graph.packages().get(0).identity());
    }

    @Test
    void longChainDoesNotOverflowStack() {
        List<DependencyEdge> edges = new java.util.ArrayList<>();
        for (int i = 0; i < 20_000; i++) {
            edges.add(DependencyEdge.of("pkg" + i + "@1", "pkg" + (i + 1), "1"));
        }
        DependencyGraph graph = builder.build(edges);
        assertEquals(20_001, graph.packageCount());
        assertEquals(20_000, graph.getNode("pkg20000@1").getDepth());
    }
}
