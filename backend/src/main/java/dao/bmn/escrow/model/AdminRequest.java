package dao.bmn.escrow.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AdminRequest {

    @NotBlank
    private String caller;          // must be the factory owner

    private Boolean enabled;        // pause / bypass / whitelist flag

    private String address;         // resolver or new owner
}
