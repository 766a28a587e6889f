package com.analysis.nodeflow.session;

import com.analysis.nodeflow.api.RuntimeSession;
import com.analysis.nodeflow.infer.CodeScanner;
import com.analysis.nodeflow.infer.CodeSyntaxException;
import com.analysis.nodeflow.infer.ScanResult;

import java.time.Duration;
import java.util.*;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Interpreter stand-in for tests. It does not evaluate anything. Running code
 * binds every name the code assigns, defines or imports, and persistence code
 * reports the artifact paths it would write. Code fails when it contains
 * {@code raise }, reads a watched name that is not bound, or matches a
 * configured failure; {@code sleep_forever} times out.
 */
public final class FakeSession implements RuntimeSession {
    private static final Pattern WRITES = Pattern.compile(
            "to_parquet\\('([^']+)'\\)|open\\('([^']+)', 'wb?'|savefig\\('([^']+)'\\)");

    private final CodeScanner scanner = new CodeScanner();
    private final Map<String, SessionValue> values = new LinkedHashMap<>();
    private final Map<String, String> typeNames = new HashMap<>();
    private final Map<String, String> failures = new LinkedHashMap<>();
    private final Set<String> watched = new HashSet<>();
    private final List<String> executed = new ArrayList<>();
    private Consumer<String> artifacts = path -> {
    };
    private int checkExistCalls;
    private boolean closed;

    /** Paths written by persistence code go to {@code sink}. */
    public FakeSession withArtifacts(Consumer<String> sink) {
        this.artifacts = sink;
        return this;
    }

    /** Reading one of these names while it is unbound fails with a NameError. */
    public FakeSession watching(Collection<String> names) {
        watched.addAll(names);
        return this;
    }

    /** Type name reported for {@code name}; defaults to {@code DataFrame}, or {@code function} for defs. */
    public FakeSession typeOf(String name, String typeName) {
        typeNames.put(name, typeName);
        return this;
    }

    /** Any code containing {@code fragment} fails with {@code error}. */
    public FakeSession failOn(String fragment, String error) {
        failures.put(fragment, error);
        return this;
    }

    public FakeSession clearFailures() {
        failures.clear();
        return this;
    }

    public FakeSession bind(String name) {
        values.put(name, new SessionValue(name, typeNames.getOrDefault(name, "DataFrame"), false));
        return this;
    }

    @Override
    public Map<String, Boolean> checkExist(List<String> names) {
        checkExistCalls++;
        Map<String, Boolean> out = new LinkedHashMap<>();
        for (String name : names)
            out.put(name, values.containsKey(name));
        return out;
    }

    @Override
    public SessionOutcome execute(String code, Duration timeout) {
        if (closed)
            throw new IllegalStateException("session closed");
        executed.add(code);
        if (code.contains("sleep_forever"))
            return SessionOutcome.timeout("");
        if (code.contains("raise "))
            return SessionOutcome.error("Traceback (most recent call last)", "Exception: raised by node code");
        for (var f : failures.entrySet())
            if (code.contains(f.getKey()))
                return SessionOutcome.error("", f.getValue());

        ScanResult scan;
        try {
            scan = scanner.scan(code);
        } catch (CodeSyntaxException e) {
            return SessionOutcome.error("", "SyntaxError: " + e.getMessage());
        }
        for (String name : scan.reads())
            if (watched.contains(name) && !values.containsKey(name) && !scan.assigned().contains(name)
                    && !scan.defined().contains(name) && !scan.bound().contains(name))
                return SessionOutcome.error("", "NameError: name '" + name + "' is not defined");

        for (String name : scan.assigned())
            bindValue(name, code.contains(name + " = lambda"));
        for (String name : scan.defined())
            bindValue(name, true);
        for (String name : scan.bound())
            bindValue(name, false);

        Matcher m = WRITES.matcher(code);
        while (m.find())
            for (int g = 1; g <= 3; g++)
                if (m.group(g) != null)
                    artifacts.accept(m.group(g));
        return SessionOutcome.success("");
    }

    private void bindValue(String name, boolean callable) {
        if (name.startsWith("_nf_"))
            return;
        String type = typeNames.getOrDefault(name, callable ? "function" : "DataFrame");
        values.put(name, new SessionValue(name, type, callable));
    }

    @Override
    public Optional<SessionValue> getValue(String name) {
        return Optional.ofNullable(values.get(name));
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean isBound(String name) {
        return values.containsKey(name);
    }

    /** Code blocks in the order they were run. */
    public List<String> executed() {
        return executed;
    }

    /** Number of executed blocks that contain {@code fragment}. */
    public long executedContaining(String fragment) {
        return executed.stream().filter(c -> c.contains(fragment)).count();
    }

    public int checkExistCalls() {
        return checkExistCalls;
    }
}
