package dao.bmn.escrow.error;

import lombok.Getter;

@Getter
public enum ErrorCode {
    INVALID_TIME(ErrorCategory.TEMPORAL, "Call outside the allowed time window"),
    INVALID_CREATION_TIME(ErrorCategory.TEMPORAL, "Escrow timelocks are not acceptable at creation"),

    INVALID_CALLER(ErrorCategory.AUTHORIZATION, "Caller is not allowed to perform this action"),
    NOT_OWNER(ErrorCategory.AUTHORIZATION, "Caller is not the factory owner"),
    NOT_WHITELISTED_RESOLVER(ErrorCategory.AUTHORIZATION, "Resolver is not whitelisted"),

    INVALID_SECRET(ErrorCategory.CRYPTOGRAPHIC, "Secret does not match the hashlock"),
    INVALID_IMMUTABLES(ErrorCategory.CRYPTOGRAPHIC, "Immutables do not match the deployed escrow"),

    INVALID_STATE(ErrorCategory.STATE, "Escrow is already withdrawn or cancelled"),
    ESCROW_ALREADY_EXISTS(ErrorCategory.STATE, "An escrow for this hashlock already exists"),
    FACTORY_PAUSED(ErrorCategory.STATE, "Escrow creation is paused"),
    ESCROW_NOT_FOUND(ErrorCategory.STATE, "No escrow at this address or hashlock"),

    INSUFFICIENT_BALANCE(ErrorCategory.VALUE_TRANSFER, "Insufficient balance"),
    INSUFFICIENT_ALLOWANCE(ErrorCategory.VALUE_TRANSFER, "Insufficient allowance"),

    INVALID_PAYLOAD(ErrorCategory.CONFIGURATION, "Malformed parameters"),
    UNKNOWN_CHAIN(ErrorCategory.CONFIGURATION, "Chain is not configured");

    private final ErrorCategory category;
    private final String description;

    ErrorCode(ErrorCategory category, String description) {
        this.category = category;
        this.description = description;
    }
}
