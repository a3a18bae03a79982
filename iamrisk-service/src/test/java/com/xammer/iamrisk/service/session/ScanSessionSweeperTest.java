package com.xammer.iamrisk.service.session;

import com.xammer.iamrisk.dto.PermissionSetDetails;
import com.xammer.iamrisk.repository.InMemoryScanSessionRepository;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ScanSessionSweeperTest {

    @Test
    void sweepRemovesSessionsPastTheirTtl() {
        Clock clock = mock(Clock.class);
        Instant start = Instant.parse("2024-05-01T10:00:00Z");
        when(clock.instant()).thenReturn(start);
        ScanSessionStore store = new ScanSessionStore(new InMemoryScanSessionRepository(), clock, Duration.ofHours(1));
        String id = store.startNewScan("default",
                List.of(PermissionSetDetails.fromArn("arn:aws:sso:::permissionSet/ssoins-1/ps-a")), "us-east-1", null);
        ScanSessionSweeper sweeper = new ScanSessionSweeper(store);

        sweeper.purgeExpiredSessions();
        assertTrue(store.getSession(id).isPresent());

        when(clock.instant()).thenReturn(start.plus(Duration.ofHours(2)));
        sweeper.purgeExpiredSessions();
        assertTrue(store.getSession(id).isEmpty());
    }
}
