package eu.virtualparadox.docindex.ingest.lifecycle;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic age-based garbage collection, enabled with {@code docindex.maintenance.enabled=true}.
 */
@Slf4j
@Component
@EnableScheduling
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "docindex.maintenance", name = "enabled", havingValue = "true")
public class IndexMaintenanceScheduler {

    private final IndexLifecycleManager lifecycleManager;

    @Value("${docindex.maintenance.older-than-days:30}")
    private int olderThanDays;

    @Scheduled(cron = "${docindex.maintenance.cron:0 0 3 * * *}")
    public void cleanupOldIndexes() {
        try {
            final int removed = lifecycleManager.cleanupOlderThan(olderThanDays);
            log.info("Scheduled maintenance removed {} index(es)", removed);
        } catch (RuntimeException e) {
            log.error("Scheduled index maintenance failed", e);
        }
    }
}
