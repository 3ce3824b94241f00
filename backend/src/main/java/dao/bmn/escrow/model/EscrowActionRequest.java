package dao.bmn.escrow.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class EscrowActionRequest {

    @NotBlank
    private String caller;

    private String secret;          // bytes32 hex, withdrawals only

    private String target;          // withdrawTo recipient, source escrows only

    private String endorsement;     // 65-byte hex signature, public actions only
}
