package com.knowledgeengine.clustering;

import com.knowledgeengine.common.model.ClusterInfo;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Изменяемое состояние кластера внутри движка; наружу отдаётся только {@link ClusterInfo} */
@Getter
class Cluster {

    private final int id;

    @Setter(AccessLevel.PACKAGE)
    private String name;

    /** Нормализованные концепты, самые релевантные первыми */
    private final Set<String> concepts;

    private final Set<Long> documentIds = new LinkedHashSet<>();

    @Setter(AccessLevel.PACKAGE)
    private String skillLevel;

    Cluster(int id, String name, List<String> concepts, String skillLevel) {
        this.id = id;
        this.name = name;
        this.concepts = new LinkedHashSet<>(concepts);
        this.skillLevel = skillLevel;
    }

    String normalizedName() {
        return ConceptNormalizer.normalize(name);
    }

    boolean addDocument(long documentId) {
        return documentIds.add(documentId);
    }

    boolean removeDocument(long documentId) {
        return documentIds.remove(documentId);
    }

    ClusterInfo toInfo() {
        return new ClusterInfo(id, name, new ArrayList<>(concepts), new ArrayList<>(documentIds), skillLevel);
    }
}
