package com.analysis.nodeflow.api;

/** Starts a fresh session for a project, with the project directory as working directory. */
@FunctionalInterface
public interface SessionFactory {
    RuntimeSession create(String projectId);
}
