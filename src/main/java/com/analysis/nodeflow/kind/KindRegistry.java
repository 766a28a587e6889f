package com.analysis.nodeflow.kind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Registry mapping {@link NodeKind}s to their {@link KindRules}.
 *
 * <p>
 * Built once by the caller and passed to whatever needs it; there is no
 * global instance.
 */
public final class KindRegistry {
    private final Map<NodeKind, KindRules> registry = new EnumMap<>(NodeKind.class);

    /** Registry with the built-in rules for every kind. */
    public static KindRegistry standard() {
        KindRegistry registry = new KindRegistry();
        registry.registerBuiltIns();
        return registry;
    }

    public KindRegistry register(KindRules rules) {
        registry.put(rules.kind(), rules);
        return this;
    }

    public KindRules rules(NodeKind kind) {
        KindRules rules = registry.get(kind);
        if (rules == null)
            throw new IllegalArgumentException("No rules registered for kind: " + kind.tag());
        return rules;
    }

    public boolean isRegistered(NodeKind kind) {
        return registry.containsKey(kind);
    }

    private void registerBuiltIns() {
        // --- Tabular kinds ---
        register(new StandardKindRules(NodeKind.DATA_SOURCE, Set.of("DataFrame")));
        register(new StandardKindRules(NodeKind.COMPUTE, Set.of("DataFrame")));

        // --- Structured and visual kinds ---
        register(new StandardKindRules(NodeKind.DICT, Set.of("dict")));
        register(new StandardKindRules(NodeKind.CHART, Set.of("Figure", "dict")));
        register(new StandardKindRules(NodeKind.IMAGE, Set.of("Figure", "Image", "str")));

        // --- Callables ---
        register(new StandardKindRules(NodeKind.TOOL, Set.of()));
    }
}
