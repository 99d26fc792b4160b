package com.ownding.telemetry.retention;

import com.ownding.telemetry.sample.SamplePayload;
import com.ownding.telemetry.sample.SampleRepository;
import com.ownding.telemetry.sample.SampleService;
import com.ownding.telemetry.user.UserAccount;
import com.ownding.telemetry.user.UserService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest(properties = "app.retention.mode=ASYNC")
@ActiveProfiles("test")
class AsyncEnforcementTests {

    private static final Instant BASE = Instant.parse("2026-02-01T00:00:00Z");

    @Autowired
    private UserService userService;

    @Autowired
    private SampleService sampleService;

    @Autowired
    private SampleRepository sampleRepository;

    @Autowired
    private EnforcementDispatcher enforcementDispatcher;

    @Test
    void asyncModeConvergesToCapAfterIngestReturns() throws Exception {
        assertEquals(EnforcementMode.ASYNC, enforcementDispatcher.mode());
        UserAccount user = userService.createUser(
                new UserService.CreateUserCommand("async-" + UUID.randomUUID(), null, "free"));

        SampleService.IngestResult last = null;
        for (int i = 1; i <= 45; i++) {
            last = sampleService.ingest(new SampleService.IngestCommand(user.id(), "band-async",
                    BASE.plusSeconds(i).toString(),
                    new SamplePayload(65, null, 0.0, 0.0, 1.0, null, null, null)));
            assertEquals("SCHEDULED", last.enforcement());
        }

        SeriesKey key = new SeriesKey(last.userId(), last.deviceId());
        long deadline = System.currentTimeMillis() + 10_000;
        while (sampleRepository.countSamples(key) > 30 && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }

        assertEquals(30, sampleRepository.countSamples(key));
        assertEquals(BASE.plusSeconds(16), sampleRepository.findSeries(key).get(29).timestamp());
    }
}
