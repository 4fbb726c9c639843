package org.learningjava.carbonengine.domain.model.calculation;

public enum BackendType {
    VECTOR_MATCH,
    ASSISTANT,
    DEMO
}
