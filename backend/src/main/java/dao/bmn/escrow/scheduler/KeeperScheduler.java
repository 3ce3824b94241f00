package dao.bmn.escrow.scheduler;

import dao.bmn.escrow.config.SchedulerProperties;
import dao.bmn.escrow.service.KeeperService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class KeeperScheduler {

    private final KeeperService keeperService;
    private final SchedulerProperties schedulerProps;

    public KeeperScheduler(KeeperService keeperService, SchedulerProperties schedulerProps) {
        this.keeperService = keeperService;
        this.schedulerProps = schedulerProps;
    }

    @Scheduled(fixedDelayString = "${scheduler.keeper.check-interval-ms:5000}")
    public void finishExpiredOrRevealed() {
        if (!schedulerProps.getKeeper().isEnabled()) {
            return;
        }
        try {
            keeperService.runOnce();
        } catch (Exception e) {
            log.error("Keeper pass failed: {}", e.getMessage(), e);
        }
    }
}
