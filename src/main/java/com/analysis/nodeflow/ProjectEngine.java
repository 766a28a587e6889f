package com.analysis.nodeflow;

import com.analysis.nodeflow.api.ExecutionListener;
import com.analysis.nodeflow.api.NodeStore;
import com.analysis.nodeflow.engine.AnalysisReport;
import com.analysis.nodeflow.engine.ChainReport;
import com.analysis.nodeflow.engine.DependencyAnalyzer;
import com.analysis.nodeflow.engine.DependencyGraph;
import com.analysis.nodeflow.engine.ExecutionPlan;
import com.analysis.nodeflow.engine.ValidationReport;
import com.analysis.nodeflow.exec.EdgeDiscovery;
import com.analysis.nodeflow.exec.ExecutionOrchestrator;
import com.analysis.nodeflow.exec.ExecutionReport;
import com.analysis.nodeflow.infer.BindingChecker;
import com.analysis.nodeflow.infer.CodeScanner;
import com.analysis.nodeflow.infer.DependencyInferencer;
import com.analysis.nodeflow.infer.ReservedNames;
import com.analysis.nodeflow.io.EngineConfig;
import com.analysis.nodeflow.kind.KindRegistry;
import com.analysis.nodeflow.session.SessionPool;
import com.analysis.nodeflow.store.JsonProjectStore;
import com.analysis.nodeflow.store.NodeRecord;
import com.analysis.nodeflow.util.GraphExplain;
import com.analysis.nodeflow.util.LoggingExecutionListener;
import com.analysis.nodeflow.util.NodeProfileListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.time.Clock;
import java.util.*;

/**
 * Entry point for one project: graph queries, planning and execution.
 * <p>
 * This class wires:
 * <ul>
 * <li>a {@link NodeStore} holding node code and committed state</li>
 * <li>the {@link DependencyInferencer} that derives edges from code</li>
 * <li>the {@link ExecutionOrchestrator} running nodes in the project's pooled
 * session</li>
 * </ul>
 * Graph queries use inferred or committed edges depending on
 * {@link EngineConfig#getEdgeMode()}.
 */
public class ProjectEngine {
    private static final Logger log = LogManager.getLogger(ProjectEngine.class);

    private final String projectId;
    private final NodeStore store;
    private final SessionPool pool;
    private final EngineConfig config;
    private final EdgeDiscovery discovery;
    private final ExecutionOrchestrator orchestrator;

    public ProjectEngine(String projectId, NodeStore store, SessionPool pool, KindRegistry kinds,
            EngineConfig config) {
        this(projectId, store, pool, kinds, config, Clock.systemUTC());
    }

    public ProjectEngine(String projectId, NodeStore store, SessionPool pool, KindRegistry kinds,
            EngineConfig config, Clock clock) {
        this.projectId = Objects.requireNonNull(projectId, "projectId");
        this.store = Objects.requireNonNull(store, "store");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.config = Objects.requireNonNull(config, "config");

        CodeScanner scanner = new CodeScanner();
        var inferencer = new DependencyInferencer(scanner, new ReservedNames(config.getExtraReservedNames()));
        this.discovery = new EdgeDiscovery(store, inferencer);
        this.orchestrator = new ExecutionOrchestrator(store, kinds, discovery, new BindingChecker(scanner), config,
                clock);
        this.orchestrator.addListener(new LoggingExecutionListener());
    }

    /**
     * Opens a project directory with the built-in node kinds.
     *
     * @param projectDir directory containing {@code project.json}
     */
    public static ProjectEngine open(Path projectDir, SessionPool pool, EngineConfig config) {
        JsonProjectStore store = JsonProjectStore.open(projectDir);
        return new ProjectEngine(store.projectId(), store, pool, KindRegistry.standard(), config);
    }

    public String projectId() {
        return projectId;
    }

    /**
     * Registers a listener for execution events, in addition to the ones
     * already registered.
     */
    public void addListener(ExecutionListener listener) {
        orchestrator.addListener(listener);
    }

    /**
     * Enables per-node timing statistics.
     * Use the returned listener to dump them.
     */
    public NodeProfileListener enableNodeProfiling() {
        var profileListener = new NodeProfileListener();
        orchestrator.addListener(profileListener);
        return profileListener;
    }

    /** Builds the current graph from the store. */
    public DependencyGraph graph() {
        List<NodeRecord> nodes = store.listNodes();
        return DependencyAnalyzer.buildGraph(discovery.edges(nodes, config.getEdgeMode()));
    }

    public AnalysisReport analyze(String target) {
        return DependencyAnalyzer.analyze(graph(), target);
    }

    /** Plan assuming exactly {@code alreadyExecuted} have usable output. */
    public ExecutionPlan plan(String target, Set<String> alreadyExecuted) {
        return DependencyAnalyzer.executionPlan(graph(), target, alreadyExecuted);
    }

    /**
     * Plan using what is actually available: values bound in the project's
     * session, plus validated nodes whose artifact exists. Never starts a
     * session.
     */
    public ExecutionPlan plan(String target) {
        DependencyGraph graph = graph();
        Set<String> done = new HashSet<>();
        for (NodeRecord node : store.listNodes())
            if (node.isValidated() && node.hasResult() && store.artifactExists(node.result()))
                done.add(node.id());

        Optional<SessionPool.Lease> lease = pool.acquireExisting(projectId);
        if (lease.isPresent()) {
            try (SessionPool.Lease l = lease.get()) {
                var exist = l.session().checkExist(new ArrayList<>(graph.nodeIds()));
                for (var e : exist.entrySet())
                    if (Boolean.TRUE.equals(e.getValue()))
                        done.add(e.getKey());
            }
        }
        ExecutionPlan plan = DependencyAnalyzer.executionPlan(graph, target, done);
        log.debug("Plan for {}: run {}, skip {}", target, plan.toRun(), plan.skipped());
        return plan;
    }

    /** Runs {@code target} and whatever it needs in the project's session. */
    public ExecutionReport execute(String target) {
        try (SessionPool.Lease lease = pool.acquire(projectId)) {
            return orchestrator.execute(lease.session(), target);
        }
    }

    public ValidationReport validateGraph() {
        ValidationReport report = DependencyAnalyzer.validate(graph());
        if (!report.valid())
            log.warn("Graph of project {} is invalid: {}", projectId, report.errors());
        return report;
    }

    public ChainReport findChains() {
        return DependencyAnalyzer.findChains(graph());
    }

    /** Mermaid diagram of the graph with node states. */
    public String explain() {
        return explainer().toMermaid();
    }

    public String explainNode(String id) {
        return explainer().explainNode(id);
    }

    private GraphExplain explainer() {
        Map<String, NodeRecord> records = new LinkedHashMap<>();
        for (NodeRecord node : store.listNodes())
            records.put(node.id(), node);
        return new GraphExplain(graph(), records);
    }
}
