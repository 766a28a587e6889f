package com.analysis.nodeflow.infer;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Names never treated as node references: builtins, container types,
 * conventional library aliases and common exception names.
 */
public final class ReservedNames {
    public static final Set<String> DEFAULTS = Set.of(
            // library aliases and modules
            "pd", "np", "plt", "sns", "px", "go", "alt", "json", "os", "re", "math", "datetime", "time", "sys",
            "pickle",
            // builtins
            "print", "len", "range", "list", "dict", "set", "tuple", "str", "int", "float", "bool", "type",
            "object", "open", "zip", "enumerate", "map", "filter", "sorted", "sum", "min", "max", "abs", "round",
            "isinstance", "display",
            // constants
            "None", "True", "False",
            // exceptions
            "Exception", "ValueError", "TypeError", "KeyError", "IndexError", "RuntimeError", "AttributeError");

    private final Set<String> names;

    public ReservedNames(Collection<String> extra) {
        Set<String> all = new HashSet<>(DEFAULTS);
        all.addAll(extra);
        this.names = Set.copyOf(all);
    }

    public static ReservedNames defaults() {
        return new ReservedNames(Set.of());
    }

    public boolean contains(String name) {
        return names.contains(name);
    }
}
