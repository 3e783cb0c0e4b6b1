package com.nisfix.compliance.application;

import com.nisfix.compliance.domain.SecureLink;
import com.nisfix.compliance.domain.SecureLinkType;
import com.nisfix.compliance.domain.ports.SecureLinkRepository;
import com.nisfix.compliance.exception.AlreadyUsedException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ConcurrentRedemptionTest {

    private static final int THREADS = 8;

    @Autowired private TokenIssuer tokenIssuer;
    @Autowired private SecureLinkRepository links;

    @Test
    void shouldLetExactlyOneConcurrentRedemptionSucceed() throws Exception {
        SecureLink link = tokenIssuer.issue("race-" + UUID.randomUUID() + "@acme.test", SecureLinkType.AUTH,
                UUID.randomUUID(), null, Duration.ofMinutes(15));
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        List<Future<SecureLink>> attempts = new ArrayList<>();

        try {
            for (int i = 0; i < THREADS; i++) {
                Callable<SecureLink> redeem = () -> {
                    start.await();
                    return tokenIssuer.redeem(link.getIdentifier(), SecureLinkType.AUTH);
                };
                attempts.add(pool.submit(redeem));
            }
            start.countDown();

            int succeeded = 0;
            List<Throwable> failures = new ArrayList<>();
            for (Future<SecureLink> attempt : attempts) {
                try {
                    attempt.get(30, TimeUnit.SECONDS);
                    succeeded++;
                } catch (ExecutionException e) {
                    failures.add(e.getCause());
                }
            }

            assertThat(succeeded).isEqualTo(1);
            assertThat(failures).hasSize(THREADS - 1).allSatisfy(
                    failure -> assertThat(failure).isInstanceOf(AlreadyUsedException.class));
        } finally {
            pool.shutdownNow();
        }

        SecureLink stored = links.findByIdentifier(link.getIdentifier()).orElseThrow();
        assertThat(stored.isUsed()).isTrue();
    }
}
