package com.analysis.nodeflow.store;

import com.analysis.nodeflow.api.NodeStore;
import com.analysis.nodeflow.kind.NodeKind;
import com.analysis.nodeflow.kind.ResultFormat;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Node store backed by a project directory.
 *
 * <pre>
 * &lt;project&gt;/
 *   project.json        metadata for all nodes
 *   nodes/&lt;id&gt;.py        node code, unless inlined in project.json
 *   parquets/ functions/ visualizations/   artifacts
 * </pre>
 *
 * Every commit rewrites {@code project.json} through a temporary file and an
 * atomic rename, so a crash never leaves a half-written file behind.
 */
public final class JsonProjectStore implements NodeStore {
    private static final Logger log = LogManager.getLogger(JsonProjectStore.class);

    public static final String PROJECT_FILE = "project.json";
    public static final String CODE_DIR = "nodes";

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Path projectDir;
    private final ProjectDefinition definition;

    private JsonProjectStore(Path projectDir, ProjectDefinition definition) {
        this.projectDir = projectDir;
        this.definition = definition;
    }

    /** Opens an existing project directory. */
    public static JsonProjectStore open(Path projectDir) {
        Path file = projectDir.resolve(PROJECT_FILE);
        try {
            ProjectDefinition def = MAPPER.readValue(file.toFile(), ProjectDefinition.class);
            if (def.getNodes() == null)
                def.setNodes(new ArrayList<>());
            log.info("Opened project {} with {} nodes", def.getProjectId(), def.getNodes().size());
            return new JsonProjectStore(projectDir, def);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    /** Creates a new, empty project directory. */
    public static JsonProjectStore create(Path projectDir, String projectId, String name) {
        if (Files.exists(projectDir.resolve(PROJECT_FILE)))
            throw new IllegalArgumentException("Project already exists: " + projectDir);
        ProjectDefinition def = new ProjectDefinition();
        def.setProjectId(projectId);
        def.setName(name);
        def.setDescription("");
        String now = Instant.now().toString();
        def.setCreatedAt(now);
        def.setUpdatedAt(now);
        JsonProjectStore store = new JsonProjectStore(projectDir, def);
        try {
            Files.createDirectories(projectDir.resolve(CODE_DIR));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create " + projectDir, e);
        }
        store.save();
        return store;
    }

    public Path projectDir() {
        return projectDir;
    }

    public synchronized String projectId() {
        return definition.getProjectId();
    }

    /**
     * Adds a node, or replaces the code and kind of an existing one. The code
     * goes to {@code nodes/<id>.py}. Committed state is left alone.
     */
    public synchronized void defineNode(String id, NodeKind kind, String name, String code) {
        ProjectDefinition.NodeDef def = find(id).orElse(null);
        if (def == null) {
            def = new ProjectDefinition.NodeDef();
            def.setNodeId(id);
            definition.getNodes().add(def);
        }
        def.setType(kind.tag());
        def.setName(name);
        def.setCode(null);
        try {
            Path codeFile = projectDir.resolve(CODE_DIR).resolve(id + ".py");
            Files.createDirectories(codeFile.getParent());
            Files.writeString(codeFile, code, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write code of " + id, e);
        }
        save();
    }

    @Override
    public synchronized List<NodeRecord> listNodes() {
        List<NodeRecord> out = new ArrayList<>(definition.getNodes().size());
        for (ProjectDefinition.NodeDef def : definition.getNodes())
            out.add(toRecord(def));
        return out;
    }

    @Override
    public synchronized Optional<String> getNodeCode(String id) {
        Optional<ProjectDefinition.NodeDef> def = find(id);
        if (def.isEmpty())
            return Optional.empty();
        if (def.get().getCode() != null)
            return Optional.of(def.get().getCode());
        Path codeFile = projectDir.resolve(CODE_DIR).resolve(id + ".py");
        if (!Files.exists(codeFile))
            return Optional.empty();
        try {
            return Optional.of(Files.readString(codeFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read code of " + id, e);
        }
    }

    @Override
    public synchronized void commitNode(String id, NodeCommit commit) {
        ProjectDefinition.NodeDef def = find(id)
                .orElseThrow(() -> new IllegalArgumentException("Unknown node: " + id));
        def.setDependsOn(new ArrayList<>(commit.dependsOn()));
        def.setExecutionStatus(commit.state().tag());
        def.setResultFormat(commit.result() == null ? null : commit.result().format().tag());
        def.setResultPath(commit.result() == null ? null : commit.result().path());
        def.setErrorMessage(commit.errorMessage());
        def.setLastExecutionTime(commit.executedAt().toString());
        save();
        log.debug("Committed {} as {} with dependencies {}", id, commit.state(), commit.dependsOn());
    }

    @Override
    public boolean artifactExists(ResultDescriptor result) {
        return Files.exists(projectDir.resolve(result.path()));
    }

    private Optional<ProjectDefinition.NodeDef> find(String id) {
        for (ProjectDefinition.NodeDef def : definition.getNodes())
            if (id.equals(def.getNodeId()))
                return Optional.of(def);
        return Optional.empty();
    }

    private void save() {
        definition.setUpdatedAt(Instant.now().toString());
        Path target = projectDir.resolve(PROJECT_FILE);
        try {
            Files.createDirectories(projectDir);
            Path tmp = Files.createTempFile(projectDir, PROJECT_FILE, ".tmp");
            MAPPER.writeValue(tmp.toFile(), definition);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic rename not supported in {}, replacing {} in place", projectDir, PROJECT_FILE);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
    }

    private static NodeRecord toRecord(ProjectDefinition.NodeDef def) {
        ResultDescriptor result = null;
        if (def.getResultFormat() != null && def.getResultPath() != null)
            result = new ResultDescriptor(ResultFormat.fromTag(def.getResultFormat()), def.getResultPath());
        List<String> deps = def.getDependsOn() == null ? List.of() : def.getDependsOn();
        return new NodeRecord(def.getNodeId(), NodeKind.fromTag(def.getType()),
                def.getName() == null ? def.getNodeId() : def.getName(), deps,
                MaterializationState.fromTag(def.getExecutionStatus()), result, def.getErrorMessage(),
                parseTime(def.getLastExecutionTime()));
    }

    // Older files carry local ISO timestamps without an offset.
    private static Instant parseTime(String text) {
        if (text == null || text.isEmpty())
            return null;
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(text).atZone(ZoneId.systemDefault()).toInstant();
        }
    }
}
