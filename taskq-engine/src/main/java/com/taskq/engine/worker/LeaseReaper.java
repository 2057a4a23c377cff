package com.taskq.engine.worker;

import com.taskq.engine.StoreUnavailableException;
import com.taskq.engine.service.QueueEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically returns tasks whose lease ran out to their ready-set (or fails them).
 */
@Component
public class LeaseReaper {

    private static final Logger log = LoggerFactory.getLogger(LeaseReaper.class);

    private final QueueEngine engine;

    public LeaseReaper(QueueEngine engine) {
        this.engine = engine;
    }

    @Scheduled(fixedDelayString = "${taskq.lease.sweep-interval-ms:30000}",
            initialDelayString = "${taskq.lease.sweep-interval-ms:30000}")
    public void sweep() {
        int reclaimed = reclaimAll();
        if (reclaimed > 0) {
            log.info("Lease sweep reclaimed {} task(s)", reclaimed);
        }
    }

    int reclaimAll() {
        int total = 0;
        for (String queue : engine.queueNames()) {
            try {
                total += engine.reclaimExpiredLeases(queue);
            } catch (StoreUnavailableException e) {
                log.warn("Lease sweep skipped queue {}: {}", queue, e.getMessage());
            }
        }
        return total;
    }
}
