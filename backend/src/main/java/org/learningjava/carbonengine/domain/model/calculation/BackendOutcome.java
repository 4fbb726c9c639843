package org.learningjava.carbonengine.domain.model.calculation;

/**
 * Either an accepted estimate or a typed rejection. Expected fallbacks travel
 * through this type rather than through exceptions.
 */
public record BackendOutcome(
        BackendType backend,
        BackendEstimate estimate,
        RejectionReason reason,
        String detail
) {

    public static BackendOutcome accepted(BackendType backend, BackendEstimate estimate) {
        return new BackendOutcome(backend, estimate, null, null);
    }

    public static BackendOutcome rejected(BackendType backend, RejectionReason reason, String detail) {
        return new BackendOutcome(backend, null, reason, detail);
    }

    public boolean isAccepted() {
        return estimate != null;
    }

    /** One-line summary used in {@link CalculationResult#fallbackReasons()}. */
    public String describeRejection() {
        return backend + ": " + reason + (detail == null || detail.isBlank() ? "" : " (" + detail + ")");
    }
}
