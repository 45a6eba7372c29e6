package com.knowledgeengine.index.rebuild;

public enum RebuildMode {
    /** Новые документы проецируются через текущий словарь */
    INCREMENTAL,
    /** Порог мутаций достигнут, следующая запись перестроит словарь */
    PENDING_REBUILD
}
