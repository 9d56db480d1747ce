package com.innstay.booking.token;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class TokenCleanupScheduler {

    private final VerificationTokenService verificationTokenService;

    @Scheduled(cron = "${booking.token.cleanup-cron:0 30 3 * * *}")
    @SchedulerLock(name = "verificationTokenCleanup", lockAtMostFor = "PT10M")
    public void purgeExpiredTokens() {
        int deleted = verificationTokenService.purgeExpired();
        if (deleted > 0) {
            log.info("Purged {} expired verification tokens", deleted);
        }
    }
}
