package dao.bmn.escrow.error;

/**
 * How a rejected call can be recovered from.
 */
public enum ErrorCategory {
    /** Wait for the window and resubmit. */
    TEMPORAL,
    /** Only the right caller can succeed. */
    AUTHORIZATION,
    /** Needs the correct preimage or parameters. */
    CRYPTOGRAPHIC,
    /** The escrow or registry is in a state that forbids the call. */
    STATE,
    /** Balance or allowance too low; nothing was moved. */
    VALUE_TRANSFER,
    /** Malformed input handed over by a collaborator. */
    CONFIGURATION
}
