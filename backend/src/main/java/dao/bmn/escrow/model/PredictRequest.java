package dao.bmn.escrow.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class PredictRequest {

    @NotNull
    private EscrowRole role;

    @Valid
    @NotNull
    private ImmutablesRequest immutables;
}
