package com.analysis.nodeflow.store;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.Data;

/**
 * POJO representation of a project's {@code project.json}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class ProjectDefinition {
    private String projectId, name, description;
    private String version = "1.0.0";
    private String createdAt, updatedAt;
    private List<NodeDef> nodes = new ArrayList<>();

    /** Definition of a single node. Code is either inline or in {@code nodes/<id>.py}. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.ALWAYS)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static final class NodeDef {
        private String nodeId, type, name;
        private List<String> dependsOn = new ArrayList<>();
        private String executionStatus = "not_executed";
        private String resultFormat, resultPath;
        private String errorMessage;
        private String lastExecutionTime;
        @JsonInclude(JsonInclude.Include.NON_NULL)
        private String code;
    }
}
