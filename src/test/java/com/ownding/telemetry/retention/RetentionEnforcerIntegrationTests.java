package com.ownding.telemetry.retention;

import com.ownding.telemetry.device.Device;
import com.ownding.telemetry.device.DeviceService;
import com.ownding.telemetry.sample.Sample;
import com.ownding.telemetry.sample.SamplePayload;
import com.ownding.telemetry.sample.SampleRepository;
import com.ownding.telemetry.sample.SampleService;
import com.ownding.telemetry.user.UserAccount;
import com.ownding.telemetry.user.UserService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
class RetentionEnforcerIntegrationTests {

    private static final Instant BASE = Instant.parse("2026-01-01T00:00:00Z");

    @Autowired
    private UserService userService;

    @Autowired
    private DeviceService deviceService;

    @Autowired
    private SampleService sampleService;

    @Autowired
    private SampleRepository sampleRepository;

    @Autowired
    private RetentionEnforcer retentionEnforcer;

    @Autowired
    private TierResolver tierResolver;

    @Autowired
    private JdbcClient jdbcClient;

    @Test
    void keepsNewestThirtyOfThirtyFive() {
        UserAccount user = newUser("free");
        List<SampleService.IngestResult> results = new ArrayList<>();
        for (int i = 1; i <= 35; i++) {
            results.add(ingest(user, "band-a", i));
        }

        SeriesKey key = keyOf(results.get(0));
        assertEquals(30, sampleRepository.countSamples(key));
        assertEquals(secondsRange(6, 35), remainingSeconds(key));
        assertEquals("WITHIN_CAP", results.get(29).enforcement());
        assertEquals("PRUNED", results.get(30).enforcement());
        assertEquals(1, results.get(30).pruned());
    }

    @Test
    void backfilledSampleOlderThanWindowIsDroppedImmediately() {
        UserAccount user = newUser("free");
        SampleService.IngestResult first = null;
        for (int i = 1; i <= 35; i++) {
            SampleService.IngestResult result = ingest(user, "band-b", i);
            first = first == null ? result : first;
        }
        SeriesKey key = keyOf(first);

        SampleService.IngestResult backfill = ingest(user, "band-b", 0);

        assertEquals("PRUNED", backfill.enforcement());
        assertEquals(secondsRange(6, 35), remainingSeconds(key));
        assertFalse(remainingIds(key).contains(backfill.sampleId()));
    }

    @Test
    void tiedTimestampsAboveOlderSamplesAreBothKept() {
        UserAccount user = newUser("free");
        SampleService.IngestResult first = null;
        for (int i = 1; i <= 29; i++) {
            SampleService.IngestResult result = ingest(user, "band-c", i);
            first = first == null ? result : first;
        }
        SampleService.IngestResult tieLow = ingest(user, "band-c", 100);
        SampleService.IngestResult tieHigh = ingest(user, "band-c", 100);
        SeriesKey key = keyOf(first);

        Set<Long> ids = remainingIds(key);
        assertEquals(30, ids.size());
        assertTrue(ids.contains(tieLow.sampleId()));
        assertTrue(ids.contains(tieHigh.sampleId()));
        assertFalse(ids.contains(first.sampleId()));
    }

    @Test
    void tieOnCapBoundaryKeepsLaterInsert() {
        UserAccount user = newUser("free");
        SampleService.IngestResult first = null;
        for (int i = 100; i < 129; i++) {
            SampleService.IngestResult result = ingest(user, "band-d", i);
            first = first == null ? result : first;
        }
        SampleService.IngestResult tieLow = ingest(user, "band-d", 50);
        SampleService.IngestResult tieHigh = ingest(user, "band-d", 50);
        SeriesKey key = keyOf(first);

        Set<Long> ids = remainingIds(key);
        assertEquals(30, ids.size());
        assertTrue(tieHigh.sampleId() > tieLow.sampleId());
        assertTrue(ids.contains(tieHigh.sampleId()));
        assertFalse(ids.contains(tieLow.sampleId()));
    }

    @Test
    void subMicrosecondTimestampsRankByTimestampNotInsertOrder() {
        UserAccount user = newUser("free");
        userService.changeTier(user.id(), new UserService.ChangeTierCommand("free", null, 1));

        SampleService.IngestResult newer = ingestAt(user, "band-nanos", "2026-01-01T00:00:00.000000900Z");
        SampleService.IngestResult older = ingestAt(user, "band-nanos", "2026-01-01T00:00:00.000000100Z");

        assertEquals("PRUNED", older.enforcement());
        assertEquals(Set.of(newer.sampleId()), remainingIds(keyOf(newer)));
        assertEquals(Instant.parse("2026-01-01T00:00:00.000000900Z"),
                sampleRepository.findSeries(keyOf(newer)).get(0).timestamp());
        assertEquals("2026-01-01T00:00:00.000000100Z", older.timestamp());
    }

    @Test
    void repeatedEnforcementDeletesNothing() {
        UserAccount user = newUser("free");
        SampleService.IngestResult first = null;
        for (int i = 1; i <= 33; i++) {
            SampleService.IngestResult result = ingest(user, "band-e", i);
            first = first == null ? result : first;
        }
        SeriesKey key = keyOf(first);
        Set<Long> before = remainingIds(key);

        EnforcementOutcome again = retentionEnforcer.enforce(key.userId(), key.deviceId());

        assertEquals(EnforcementOutcome.Status.WITHIN_CAP, again.status());
        assertEquals(0, again.deleted());
        assertEquals(before, remainingIds(key));
    }

    @Test
    void devicesOfSameUserAreCappedIndependently() {
        UserAccount user = newUser("free");
        SampleService.IngestResult wrist = null;
        SampleService.IngestResult chest = null;
        for (int i = 1; i <= 32; i++) {
            SampleService.IngestResult result = ingest(user, "wrist", i);
            wrist = wrist == null ? result : wrist;
        }
        for (int i = 1; i <= 10; i++) {
            SampleService.IngestResult result = ingest(user, "chest", i);
            chest = chest == null ? result : chest;
        }

        assertEquals(30, sampleRepository.countSamples(keyOf(wrist)));
        assertEquals(10, sampleRepository.countSamples(keyOf(chest)));
    }

    @Test
    void premiumSeriesIsNeverPruned() {
        UserAccount user = newUser("premium");
        SampleService.IngestResult first = null;
        SampleService.IngestResult last = null;
        for (int i = 1; i <= 100; i++) {
            last = ingest(user, "band-p", i);
            first = first == null ? last : first;
        }

        assertEquals(100, sampleRepository.countSamples(keyOf(first)));
        assertEquals("UNBOUNDED", last.enforcement());
    }

    @Test
    void downgradeToFreeIsAppliedOnNextInsert() {
        UserAccount user = newUser("premium");
        SampleService.IngestResult first = null;
        for (int i = 1; i <= 40; i++) {
            SampleService.IngestResult result = ingest(user, "band-g", i);
            first = first == null ? result : first;
        }
        SeriesKey key = keyOf(first);
        assertEquals(40, sampleRepository.countSamples(key));

        userService.changeTier(user.id(), new UserService.ChangeTierCommand("free", null, null));
        SampleService.IngestResult next = ingest(user, "band-g", 41);

        assertEquals(11, next.pruned());
        assertEquals(secondsRange(12, 41), remainingSeconds(key));
    }

    @Test
    void lapsedPremiumSubscriptionIsCappedLikeFree() {
        UserAccount user = newUser("free");
        userService.changeTier(user.id(), new UserService.ChangeTierCommand("premium",
                Instant.now().minusSeconds(3600).toString(), null));
        SampleService.IngestResult first = null;
        for (int i = 1; i <= 31; i++) {
            SampleService.IngestResult result = ingest(user, "band-x", i);
            first = first == null ? result : first;
        }

        assertEquals(30, sampleRepository.countSamples(keyOf(first)));
    }

    @Test
    void capOverrideReplacesTierCap() {
        UserAccount user = newUser("premium");
        userService.changeTier(user.id(), new UserService.ChangeTierCommand("premium", null, 5));
        SampleService.IngestResult first = null;
        for (int i = 1; i <= 8; i++) {
            SampleService.IngestResult result = ingest(user, "band-o", i);
            first = first == null ? result : first;
        }

        assertEquals(secondsRange(4, 8), remainingSeconds(keyOf(first)));
    }

    @Test
    void malformedStoredSubscriptionEndSkipsCycle() {
        UserAccount user = newUser("free");
        SampleService.IngestResult first = null;
        for (int i = 1; i <= 31; i++) {
            SampleService.IngestResult result = ingest(user, "band-m", i);
            first = first == null ? result : first;
        }
        jdbcClient.sql("UPDATE user_account SET subscription_end = 'next tuesday' WHERE id = :id")
                .param("id", user.id())
                .update();
        tierResolver.invalidate(user.id());
        SampleService.IngestResult extra = ingest(user, "band-m", 32);

        assertEquals("SKIPPED_POLICY_UNAVAILABLE", extra.enforcement());
        assertEquals(31, sampleRepository.countSamples(keyOf(first)));
        EnforcementOutcome direct = retentionEnforcer.enforce(user.id(), first.deviceId());
        assertEquals(EnforcementOutcome.Status.SKIPPED_POLICY_UNAVAILABLE, direct.status());
    }

    @Test
    void deleteIsScopedToItsSeries() {
        UserAccount user = newUser("premium");
        SampleService.IngestResult a = ingest(user, "scope-a", 1);
        SampleService.IngestResult b = ingest(user, "scope-b", 1);

        int removed = sampleRepository.deleteByIds(keyOf(b), List.of(a.sampleId()));

        assertEquals(0, removed);
        assertEquals(1, sampleRepository.countSamples(keyOf(a)));
    }

    @Test
    void concurrentIngestSettlesOnNewestThirty() throws Exception {
        UserAccount user = newUser("free");
        Device device = deviceService.registerDevice(user.id(), "band-concurrent", "并发测试手环");
        SeriesKey key = new SeriesKey(user.id(), device.id());

        List<Integer> seconds = IntStream.rangeClosed(1, 160).boxed().collect(Collectors.toList());
        Collections.shuffle(seconds);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int worker = 0; worker < 8; worker++) {
                List<Integer> slice = seconds.subList(worker * 20, worker * 20 + 20);
                futures.add(executor.submit(() -> slice.forEach(s -> ingest(user, "band-concurrent", s))));
            }
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(secondsRange(131, 160), remainingSeconds(key));
    }

    private UserAccount newUser(String tier) {
        String username = "retention-" + UUID.randomUUID();
        return userService.createUser(new UserService.CreateUserCommand(username, null, tier));
    }

    private SampleService.IngestResult ingest(UserAccount user, String deviceCode, int second) {
        SamplePayload payload = new SamplePayload(72, 41.5, 0.01, -0.02, 0.98, 36.6, null, null);
        return sampleService.ingest(new SampleService.IngestCommand(
                user.id(), deviceCode, BASE.plusSeconds(second).toString(), payload));
    }

    private SampleService.IngestResult ingestAt(UserAccount user, String deviceCode, String timestamp) {
        SamplePayload payload = new SamplePayload(70, null, 0.0, 0.0, 1.0, null, null, null);
        return sampleService.ingest(new SampleService.IngestCommand(user.id(), deviceCode, timestamp, payload));
    }

    private static SeriesKey keyOf(SampleService.IngestResult result) {
        return new SeriesKey(result.userId(), result.deviceId());
    }

    private Set<Long> remainingIds(SeriesKey key) {
        return sampleRepository.findSeries(key).stream().map(Sample::id).collect(Collectors.toSet());
    }

    private Set<Long> remainingSeconds(SeriesKey key) {
        return sampleRepository.findSeries(key).stream()
                .map(sample -> sample.timestamp().getEpochSecond() - BASE.getEpochSecond())
                .collect(Collectors.toSet());
    }

    private static Set<Long> secondsRange(long fromInclusive, long toInclusive) {
        return IntStream.rangeClosed((int) fromInclusive, (int) toInclusive)
                .mapToObj(Long::valueOf)
                .collect(Collectors.toSet());
    }
}
