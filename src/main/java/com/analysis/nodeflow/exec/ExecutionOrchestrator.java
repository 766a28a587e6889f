package com.analysis.nodeflow.exec;

import com.analysis.nodeflow.api.ExecutionListener;
import com.analysis.nodeflow.api.NodeStore;
import com.analysis.nodeflow.api.RuntimeSession;
import com.analysis.nodeflow.engine.DependencyAnalyzer;
import com.analysis.nodeflow.error.CycleException;
import com.analysis.nodeflow.error.FormException;
import com.analysis.nodeflow.error.NodeExecutionException;
import com.analysis.nodeflow.error.NodeflowException;
import com.analysis.nodeflow.error.StructuralException;
import com.analysis.nodeflow.error.VerificationException;
import com.analysis.nodeflow.infer.BindingChecker;
import com.analysis.nodeflow.infer.ExplicitDependencies;
import com.analysis.nodeflow.io.EngineConfig;
import com.analysis.nodeflow.kind.KindRegistry;
import com.analysis.nodeflow.kind.KindRules;
import com.analysis.nodeflow.kind.PersistenceCode;
import com.analysis.nodeflow.session.SessionOutcome;
import com.analysis.nodeflow.session.SessionStatus;
import com.analysis.nodeflow.session.SessionValue;
import com.analysis.nodeflow.store.NodeCommit;
import com.analysis.nodeflow.store.NodeRecord;
import com.analysis.nodeflow.store.ResultDescriptor;
import com.analysis.nodeflow.util.CompositeExecutionListener;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs a requested node after making sure everything it reads is available.
 *
 * <p>
 * For each node, depth first:
 * <ol>
 * <li>form check: the code must bind the node's id, otherwise nothing runs;</li>
 * <li>discovery: dependencies are inferred from the code and held in a
 * {@link DependencyTransaction};</li>
 * <li>classification: one batch call asks the session which dependencies are
 * already bound;</li>
 * <li>resolution: each missing dependency is loaded from its artifact when it
 * is validated and the artifact exists, otherwise resolved recursively;</li>
 * <li>execution of the code followed by the kind's persistence code;</li>
 * <li>verification of the value the code bound;</li>
 * <li>commit of the discovered dependencies and {@code VALIDATED} state.</li>
 * </ol>
 * A failure stops the request. Only the failing node is marked
 * {@code PENDING_VALIDATION}; the nodes waiting on it are listed in the
 * exception's blocked chain and keep their stored state and edges.
 */
public final class ExecutionOrchestrator {
    private static final Logger log = LogManager.getLogger(ExecutionOrchestrator.class);

    private final NodeStore store;
    private final KindRegistry kinds;
    private final EdgeDiscovery discovery;
    private final BindingChecker binding;
    private final Duration executionTimeout;
    private final Duration loadTimeout;
    private final boolean preflight;
    private final Clock clock;
    private final CompositeExecutionListener listeners = new CompositeExecutionListener();

    public ExecutionOrchestrator(NodeStore store, KindRegistry kinds, EdgeDiscovery discovery,
            BindingChecker binding, EngineConfig config, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.kinds = Objects.requireNonNull(kinds, "kinds");
        this.discovery = Objects.requireNonNull(discovery, "discovery");
        this.binding = Objects.requireNonNull(binding, "binding");
        this.executionTimeout = config.executionTimeout();
        this.loadTimeout = config.loadTimeout();
        this.preflight = config.isPreflightCycleCheck();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void addListener(ExecutionListener listener) {
        listeners.addForComposite(listener);
    }

    /**
     * Makes {@code targetId}'s value available in {@code session}, running
     * whatever upstream nodes are needed. The target itself always runs.
     * Failures are reported, not thrown.
     */
    public ExecutionReport execute(RuntimeSession session, String targetId) {
        Request request = new Request(session, store.listNodes());
        log.info("Execution of {} requested ({} nodes in project)", targetId, request.records.size());
        listeners.onRequestStart(targetId);

        ExecutionReport report;
        try {
            request.record(targetId);
            if (preflight)
                preflight(request, targetId);
            resolve(request, targetId, ExecutionStack.empty());
            report = ExecutionReport.success(targetId, request.runs, request.transactions);
        } catch (NodeflowException e) {
            log.error("Execution of {} failed at {} ({}): {}", targetId, e.nodeId(), e.kind(), e.getMessage());
            request.runs.add(new NodeRun(e.nodeId(), NodeRun.Action.FAILED, 0, ""));
            report = ExecutionReport.failure(targetId, request.runs, request.transactions, e);
        }
        log.info("Execution finished: {}", report.summary());
        listeners.onRequestEnd(report);
        return report;
    }

    /** Rejects statically visible cycles before anything runs. */
    private void preflight(Request request, String targetId) {
        var edges = discovery.reachableEdges(targetId, new ArrayList<>(request.records.values()));
        try {
            DependencyAnalyzer.executionOrder(DependencyAnalyzer.buildGraph(edges), targetId);
        } catch (CycleException e) {
            listeners.onNodeFailed(e.nodeId(), e);
            throw e;
        }
    }

    private DependencyTransaction resolve(Request request, String nodeId, ExecutionStack stack) {
        NodeRecord node = request.record(nodeId);
        KindRules rules = kinds.rules(node.kind());
        String code = store.getNodeCode(nodeId).orElse(null);

        // 1. form check
        if (code == null || code.isBlank())
            throw fail(request, node, new FormException(nodeId, "Node '" + nodeId + "' has no code"));
        if (!binding.binds(nodeId, code, node.kind().producesCallable())) {
            String expected = node.kind().producesCallable()
                    ? "assign or define '" + nodeId + "'"
                    : "assign a value to '" + nodeId + "'";
            throw fail(request, node, new FormException(nodeId, "Code of node '" + nodeId + "' must " + expected));
        }

        // 2. discovery
        List<String> explicit = ExplicitDependencies.extract(code);
        Set<String> unknown = new TreeSet<>(explicit);
        unknown.removeAll(request.records.keySet());
        if (!unknown.isEmpty())
            throw fail(request, node, StructuralException.missingDependencies(nodeId, unknown));
        List<String> deps = discovery.discover(nodeId, code, request.records.keySet());
        DependencyTransaction tx = DependencyTransaction.begin(node, deps);
        request.transactions.add(tx);

        // 3. classification
        ExecutionStack path = stack.push(nodeId);
        for (String dep : deps)
            if (path.contains(dep)) {
                CycleException cycle = CycleException.dynamicCycle(nodeId, path.cycleTo(dep));
                listeners.onNodeFailed(nodeId, cycle);
                throw cycle;
            }
        Set<String> resident = resident(request, deps);
        log.debug("{}: dependencies {}, resident {}", nodeId, deps, resident);

        // 4. resolution
        for (String dep : deps) {
            if (resident.contains(dep) || request.completed.contains(dep))
                continue;
            NodeRecord depNode = request.record(dep);
            if (depNode.isValidated() && depNode.hasResult() && store.artifactExists(depNode.result())
                    && load(request, depNode))
                continue;
            try {
                resolve(request, dep, path);
            } catch (NodeflowException e) {
                e.blocked(nodeId);
                throw e;
            }
        }

        // 5. execution
        ResultDescriptor planned = rules.describe(nodeId);
        String program = code + "\n\n" + PersistenceCode.saveSnippet(nodeId, planned);
        long start = System.nanoTime();
        SessionOutcome outcome = run(request.session, nodeId, program, executionTimeout);
        long nanos = System.nanoTime() - start;
        if (outcome.status() == SessionStatus.TIMEOUT)
            throw fail(request, node, NodeExecutionException.timeout(nodeId,
                    "Execution of '" + nodeId + "' timed out after " + executionTimeout.toSeconds() + "s",
                    outcome.output()));
        if (outcome.status() == SessionStatus.ERROR)
            throw fail(request, node, NodeExecutionException.error(nodeId,
                    "Execution of '" + nodeId + "' failed: " + outcome.error(), outcome.output()));

        // 6. verification
        ResultDescriptor verified;
        try {
            SessionValue value = request.session.getValue(nodeId).orElse(null);
            verified = rules.validate(nodeId, value);
            if (node.kind().producesCallable() && !store.artifactExists(verified))
                throw new VerificationException(nodeId,
                        "Node '" + nodeId + "' ran but its artifact " + verified.path() + " was not written");
        } catch (VerificationException e) {
            throw fail(request, node, e);
        }

        // 7. commit
        NodeCommit commit = tx.commit(store, verified, clock.instant());
        request.records.put(nodeId, node.apply(commit));
        request.completed.add(nodeId);
        request.runs.add(new NodeRun(nodeId, NodeRun.Action.EXECUTED, TimeUnit.NANOSECONDS.toMillis(nanos),
                outcome.output()));
        if (!tx.addedEdges().isEmpty() || !tx.removedEdges().isEmpty())
            log.info("{} dependencies now {} (added {}, removed {})", nodeId, deps, tx.addedEdges(),
                    tx.removedEdges());
        listeners.onNodeExecuted(nodeId, nanos);
        return tx;
    }

    private Set<String> resident(Request request, List<String> deps) {
        if (deps.isEmpty())
            return Set.of();
        Map<String, Boolean> exist = request.session.checkExist(deps);
        Set<String> resident = new HashSet<>();
        for (String dep : deps) {
            if (!Boolean.TRUE.equals(exist.get(dep)))
                continue;
            resident.add(dep);
            if (request.completed.add(dep))
                request.runs.add(new NodeRun(dep, NodeRun.Action.RESIDENT, 0, ""));
        }
        return resident;
    }

    /** Binds a validated node from its artifact. Returns false if it has to be re-executed instead. */
    private boolean load(Request request, NodeRecord node) {
        Optional<String> snippet = PersistenceCode.loadSnippet(node.id(), node.result());
        if (snippet.isEmpty())
            return false;
        long start = System.nanoTime();
        SessionOutcome outcome = run(request.session, node.id(), snippet.get(), loadTimeout);
        long nanos = System.nanoTime() - start;
        if (!outcome.isSuccess()) {
            log.warn("Loading {} from {} failed ({}: {}); re-executing", node.id(), node.result().path(),
                    outcome.status(), outcome.error());
            return false;
        }
        request.completed.add(node.id());
        request.runs.add(new NodeRun(node.id(), NodeRun.Action.LOADED, TimeUnit.NANOSECONDS.toMillis(nanos), ""));
        listeners.onNodeLoaded(node.id(), nanos);
        return true;
    }

    private SessionOutcome run(RuntimeSession session, String nodeId, String program, Duration timeout) {
        try {
            return session.execute(program, timeout);
        } catch (RuntimeException e) {
            log.error("Session call for {} failed", nodeId, e);
            return SessionOutcome.error("", e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /** Marks the node pending with the failure's message and hands the failure back for throwing. */
    private NodeflowException fail(Request request, NodeRecord node, NodeflowException error) {
        NodeCommit pending = NodeCommit.pending(node, error.getMessage(), clock.instant());
        store.commitNode(node.id(), pending);
        request.records.put(node.id(), node.apply(pending));
        listeners.onNodeFailed(node.id(), error);
        return error;
    }

    /** State of one request: the session, a snapshot of the records and what has happened so far. */
    private static final class Request {
        final RuntimeSession session;
        final Map<String, NodeRecord> records = new LinkedHashMap<>();
        final Set<String> completed = new HashSet<>();
        final List<NodeRun> runs = new ArrayList<>();
        final List<DependencyTransaction> transactions = new ArrayList<>();

        Request(RuntimeSession session, List<NodeRecord> nodes) {
            this.session = session;
            for (NodeRecord node : nodes)
                records.put(node.id(), node);
        }

        NodeRecord record(String id) {
            NodeRecord node = records.get(id);
            if (node == null)
                throw StructuralException.unknownNode(id);
            return node;
        }
    }
}
