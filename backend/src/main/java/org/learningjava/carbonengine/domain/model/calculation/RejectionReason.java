package org.learningjava.carbonengine.domain.model.calculation;

public enum RejectionReason {
    NO_MATCH_FOUND,
    LOW_SIMILARITY,
    CONVERSION_UNSUPPORTED,
    BACKEND_UNAVAILABLE,
    INVALID_PAYLOAD,
    DISABLED
}
