package com.driftsentinel.core.comparison;

/**
 * Raised by a statistic that cannot be computed from the data at hand.
 *
 * <p>
 * Never escapes {@link DistributionComparator}: it is turned into a
 * non-alerting {@link InsufficientData} outcome.
 * </p>
 *
 * @since 1.0.0
 */
public class InsufficientDataException extends Exception {

    private static final long serialVersionUID = 1L;

    private final InsufficientData.Reason reason;

    public InsufficientDataException(InsufficientData.Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public InsufficientData.Reason getReason() {
        return reason;
    }
}
