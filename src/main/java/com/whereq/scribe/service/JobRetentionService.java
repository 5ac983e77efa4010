package com.whereq.scribe.service;

import com.whereq.scribe.config.ScribeProperties;
import com.whereq.scribe.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic deletion of terminal jobs past the retention threshold
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobRetentionService {

    private final JobStore jobStore;
    private final ScribeProperties properties;

    @Scheduled(fixedDelayString = "${scribe.store.sweep-interval:PT1H}",
               initialDelayString = "${scribe.store.sweep-interval:PT1H}")
    public void sweep() {
        int retentionDays = properties.getStore().getRetentionDays();
        try {
            Long deleted = jobStore.sweepExpired(retentionDays).block();
            if (deleted != null && deleted > 0) {
                log.info("Retention sweep removed {} jobs older than {} days", deleted, retentionDays);
            }
        } catch (RuntimeException e) {
            log.error("Retention sweep failed: {}", e.getMessage(), e);
        }
    }
}
