package dao.bmn.escrow.config;

import dao.bmn.escrow.chain.ChainClock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    /**
     * Block time of every hosted chain: wall-clock seconds.
     */
    @Bean
    public ChainClock chainClock() {
        return ChainClock.system();
    }
}
