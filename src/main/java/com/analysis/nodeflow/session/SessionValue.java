package com.analysis.nodeflow.session;

/**
 * A value bound in a session, as seen from outside it.
 *
 * @param typeName the value's runtime type name, e.g. {@code DataFrame}
 * @param callable whether the value is a function or class
 */
public record SessionValue(String name, String typeName, boolean callable) {
}
