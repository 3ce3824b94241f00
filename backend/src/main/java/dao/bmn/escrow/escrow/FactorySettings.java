package dao.bmn.escrow.escrow;

/**
 * Per-factory constants.
 *
 * The order callback only carries two absolute instants (source cancellation and destination
 * withdrawal); the remaining stages are derived with these gaps.
 */
public record FactorySettings(
        long srcRescueDelay,
        long dstRescueDelay,
        long srcWithdrawalOffset,
        long publicWithdrawalGap,
        long publicCancellationGap,
        boolean alignDstCancellationToSrc,
        long dstCancellationLead
) {

    public static final long SEVEN_DAYS = 7L * 24 * 3600;

    public static FactorySettings defaults() {
        return new FactorySettings(SEVEN_DAYS, SEVEN_DAYS, 0L, 60L, 60L, false, 600L);
    }
}
