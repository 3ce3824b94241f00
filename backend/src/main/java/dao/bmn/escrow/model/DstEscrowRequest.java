package dao.bmn.escrow.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class DstEscrowRequest {

    @NotBlank
    private String caller;                  // resolver, becomes the payer

    @NotNull
    private Long srcCancellationTimestamp;  // unix seconds, from the source escrow

    @Valid
    @NotNull
    private ImmutablesRequest immutables;   // deployment timestamp is overwritten
}
