package dao.bmn.escrow.config;

import dao.bmn.escrow.escrow.FactorySettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "escrow")
@Data
public class EscrowProperties {

    /**
     * Seconds after deployment before the taker may sweep a source escrow.
     * Default: 604800 (7 days)
     */
    private long srcRescueDelay = FactorySettings.SEVEN_DAYS;

    /**
     * Seconds after deployment before the taker may sweep a destination escrow.
     * Default: 604800 (7 days)
     */
    private long dstRescueDelay = FactorySettings.SEVEN_DAYS;

    /**
     * Offset of the source withdrawal stage (finality lock).
     * Default: 0
     */
    private long srcWithdrawalOffset = 0;

    /**
     * Seconds between private and public withdrawal on each side.
     * Default: 60
     */
    private long publicWithdrawalGap = 60;

    /**
     * Seconds between private and public cancellation on the source side.
     * Default: 60
     */
    private long publicCancellationGap = 60;

    /**
     * Derive the destination cancellation offset from the source cancellation offset unchanged.
     * Only safe when the destination escrow is created in the same second as the source one.
     * Default: false
     */
    private boolean alignDstCancellationToSrc = false;

    /**
     * How many seconds before the source cancellation the destination leg becomes cancellable.
     * Also the maximum delay between source and destination creation.
     * Default: 600
     */
    private long dstCancellationLead = 600;

    public FactorySettings toSettings() {
        return new FactorySettings(
                srcRescueDelay,
                dstRescueDelay,
                srcWithdrawalOffset,
                publicWithdrawalGap,
                publicCancellationGap,
                alignDstCancellationToSrc,
                dstCancellationLead
        );
    }
}
