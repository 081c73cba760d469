package com.wpanther.multisigcoordinator.scheduler;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.wpanther.multisigcoordinator.service.ProposalService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Expires proposals that stopped collecting signatures.
 * Runs hourly by default (configurable via app.proposals.expiry-cron).
 */
@Component
@EnableScheduling
@RequiredArgsConstructor
@Slf4j
public class ProposalExpiryScheduler {

    private final ProposalService proposalService;

    @Value("${app.proposals.stale-after-hours:168}")
    private long staleAfterHours;

    @Value("${app.proposals.expiry-enabled:true}")
    private boolean expiryEnabled;

    @Scheduled(cron = "${app.proposals.expiry-cron:0 15 * * * *}")
    public void expireStaleProposals() {
        if (!expiryEnabled) {
            log.debug("Proposal expiry disabled, skipping sweep");
            return;
        }

        Instant cutoff = Instant.now().minus(staleAfterHours, ChronoUnit.HOURS);
        log.info("Starting sweep of stale proposals (untouched since {})", cutoff);

        try {
            int expired = proposalService.expireStale(cutoff);
            log.info("Sweep completed: {} proposals marked as expired", expired);
        } catch (Exception e) {
            log.error("Error during stale proposal sweep", e);
        }
    }
}
