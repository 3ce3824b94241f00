package dao.bmn.escrow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "endorsement")
@Data
public class EndorsementProperties {

    /**
     * Resolver private key (hex format, 64 characters) used to endorse keepers for public
     * withdraw / public cancel. Leave empty to disable endorsing.
     */
    private String privateKey;
}
