package com.knowledgeengine.common.exception;

import lombok.Getter;

@Getter
public class ClusterNotFoundException extends KnowledgeEngineException {

    private final int clusterId;

    public ClusterNotFoundException(int clusterId) {
        super("Cluster not found: " + clusterId);
        this.clusterId = clusterId;
    }
}
