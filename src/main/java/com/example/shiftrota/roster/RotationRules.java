package com.example.shiftrota.roster;

/**
 * Stability and floater policy keyed by team-relative rank.
 */
public final class RotationRules {

    public static final int FLOATER_EXEMPT_RANK = 1;

    private static final int SENIOR_STABILITY_MONTHS = 3;
    private static final int MIDDLE_STABILITY_MONTHS = 2;
    private static final int JUNIOR_STABILITY_MONTHS = 1;

    private RotationRules() {
    }

    /**
     * Maximum consecutive months an employee of the given rank may stay on one shift.
     */
    public static int stabilityMonths(int rank) {
        requireRank(rank);
        if (rank == 1) {
            return SENIOR_STABILITY_MONTHS;
        }
        if (rank == 2) {
            return MIDDLE_STABILITY_MONTHS;
        }
        return JUNIOR_STABILITY_MONTHS;
    }

    public static boolean isFloaterEligible(int rank) {
        requireRank(rank);
        return rank != FLOATER_EXEMPT_RANK;
    }

    /**
     * True when one more month on the current shift would break the stability limit.
     *
     * @param consecutiveMonths months already spent on the current shift without interruption
     */
    public static boolean mustRotate(int rank, int consecutiveMonths) {
        return consecutiveMonths >= stabilityMonths(rank);
    }

    public static boolean exceedsStability(int rank, int runLength) {
        return runLength > stabilityMonths(rank);
    }

    private static void requireRank(int rank) {
        if (rank < 1) {
            throw new IllegalArgumentException("rank must be 1 or greater: " + rank);
        }
    }
}
