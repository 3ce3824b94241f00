package dao.bmn.escrow.error;

import lombok.Getter;

/**
 * Synchronous, all-or-nothing rejection of an escrow, factory or ledger call. State is unchanged
 * whenever this is thrown.
 */
@Getter
public class SwapException extends RuntimeException {

    private final ErrorCode code;

    public SwapException(ErrorCode code) {
        super(code.getDescription());
        this.code = code;
    }

    public SwapException(ErrorCode code, String detail) {
        super(code.getDescription() + ": " + detail);
        this.code = code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }
}
