package com.mouse.keeper.service;

import com.mouse.keeper.config.KeeperProperties;
import com.mouse.keeper.enums.ChallengeState;
import com.mouse.keeper.enums.SessionFailureReason;
import com.mouse.keeper.exception.ChallengeCacheException;
import com.mouse.keeper.exception.SessionException;
import com.mouse.keeper.interfaces.ChallengeSession;
import com.mouse.keeper.model.ChallengeCacheStatus;
import com.mouse.keeper.model.Site;
import com.mouse.keeper.support.MutableClock;
import com.mouse.keeper.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class ChallengeCookieCacheTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final Duration TTL = Duration.ofMinutes(45);
    private static final Duration WINDOW = Duration.ofMinutes(10);

    private static final Map<String, String> FIRST = Map.of("acw_tc", "first", "cdn_sec_tc", "a", "acw_sc__v2", "b");
    private static final Map<String, String> SECOND = Map.of("acw_tc", "second", "cdn_sec_tc", "c", "acw_sc__v2", "d");

    @Mock
    private ChallengeSession session;

    private MutableClock clock;
    private List<Runnable> queuedRefreshes;
    private ChallengeCookieCache cache;
    private Site primary;

    @BeforeEach
    void setUp() {
        KeeperProperties properties = TestFixtures.properties();
        properties.getChallenge().setTtl(TTL);
        properties.getChallenge().setPreRefreshWindow(WINDOW);
        properties.getChallenge().setMaxSolveAttempts(2);

        clock = new MutableClock(T0);
        queuedRefreshes = new ArrayList<>();
        cache = new ChallengeCookieCache(session, properties, clock, queuedRefreshes::add);
        primary = TestFixtures.primary();
    }

    /* -------------------------- Helpers -------------------------- */

    private static KeeperProperties propertiesWithOneAttempt() {
        KeeperProperties properties = TestFixtures.properties();
        properties.getChallenge().setTtl(TTL);
        properties.getChallenge().setPreRefreshWindow(WINDOW);
        properties.getChallenge().setMaxSolveAttempts(1);
        return properties;
    }

    private void runQueuedRefreshes() {
        List<Runnable> tasks = new ArrayList<>(queuedRefreshes);
        queuedRefreshes.clear();
        tasks.forEach(Runnable::run);
    }

    /* ========================= TESTS ========================= */

    @Nested
    @DisplayName("getCookies")
    class GetCookies {

        @Test
        @DisplayName("getCookies_siteWithoutChallenge_emptyAndNoSolve")
        void getCookies_siteWithoutChallenge_emptyAndNoSolve() {
            assertThat(cache.getCookies(TestFixtures.backup(1))).isEmpty();
            verifyNoInteractions(session);
        }

        @Test
        @DisplayName("getCookies_miss_solvesOnceThenServesFromCache")
        void getCookies_miss_solvesOnceThenServesFromCache() {
            when(session.solve(primary)).thenReturn(FIRST);

            assertThat(cache.getCookies(primary)).isEqualTo(FIRST);
            clock.advance(Duration.ofMinutes(5));
            assertThat(cache.getCookies(primary)).isEqualTo(FIRST);

            verify(session, times(1)).solve(primary);
            ChallengeCacheStatus status = cache.status(primary);
            assertThat(status.getHits()).isEqualTo(1);
            assertThat(status.getMisses()).isEqualTo(1);
            assertThat(status.getState()).isEqualTo(ChallengeState.VALID);
        }

        @Test
        @Timeout(10)
        @DisplayName("getCookies_concurrentMisses_shareOneSolve")
        void getCookies_concurrentMisses_shareOneSolve() throws Exception {
            CountDownLatch solveStarted = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(session.solve(primary)).thenAnswer(inv -> {
                solveStarted.countDown();
                release.await(5, TimeUnit.SECONDS);
                return FIRST;
            });

            int callers = 8;
            CountDownLatch go = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(callers);
            try {
                List<Future<Map<String, String>>> results = new ArrayList<>();
                for (int i = 0; i < callers; i++) {
                    results.add(pool.submit(() -> {
                        go.await();
                        return cache.getCookies(primary);
                    }));
                }
                go.countDown();
                assertThat(solveStarted.await(5, TimeUnit.SECONDS)).isTrue();
                Thread.sleep(100);
                release.countDown();

                for (Future<Map<String, String>> result : results) {
                    assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo(FIRST);
                }
            } finally {
                pool.shutdownNow();
            }

            verify(session, times(1)).solve(primary);
        }

        @Test
        @Timeout(10)
        @DisplayName("getCookies_joinerOfSlowSolve_receivesLeaderResult")
        void getCookies_joinerOfSlowSolve_receivesLeaderResult() throws Exception {
            CountDownLatch solveStarted = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(session.solve(primary)).thenAnswer(inv -> {
                solveStarted.countDown();
                release.await(8, TimeUnit.SECONDS);
                return FIRST;
            });

            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                Future<Map<String, String>> leader = pool.submit(() -> cache.getCookies(primary));
                assertThat(solveStarted.await(5, TimeUnit.SECONDS)).isTrue();
                Future<Map<String, String>> joiner = pool.submit(() -> cache.getCookies(primary));

                Thread.sleep(1500);
                assertThat(joiner.isDone()).isFalse();
                release.countDown();

                assertThat(leader.get(5, TimeUnit.SECONDS)).isEqualTo(FIRST);
                assertThat(joiner.get(5, TimeUnit.SECONDS)).isEqualTo(FIRST);
            } finally {
                pool.shutdownNow();
            }
            verify(session, times(1)).solve(primary);
        }

        @Test
        @Timeout(10)
        @DisplayName("getCookies_joinerOfFailedSolve_receivesSameError")
        void getCookies_joinerOfFailedSolve_receivesSameError() throws Exception {
            CountDownLatch solveStarted = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(session.solve(primary)).thenAnswer(inv -> {
                solveStarted.countDown();
                release.await(8, TimeUnit.SECONDS);
                throw new SessionException(SessionFailureReason.CHALLENGE_TIMEOUT, "timed out");
            });
            cache = new ChallengeCookieCache(session, propertiesWithOneAttempt(), clock, queuedRefreshes::add);

            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                Future<Map<String, String>> leader = pool.submit(() -> cache.getCookies(primary));
                assertThat(solveStarted.await(5, TimeUnit.SECONDS)).isTrue();
                Future<Map<String, String>> joiner = pool.submit(() -> cache.getCookies(primary));
                Thread.sleep(500);
                release.countDown();

                assertThatThrownBy(() -> leader.get(5, TimeUnit.SECONDS))
                        .hasCauseInstanceOf(ChallengeCacheException.class);
                assertThatThrownBy(() -> joiner.get(5, TimeUnit.SECONDS))
                        .hasCauseInstanceOf(ChallengeCacheException.class);
            } finally {
                pool.shutdownNow();
            }
            verify(session, times(1)).solve(primary);
        }

        @Test
        @DisplayName("getCookies_solveAlwaysFails_errorAfterMaxAttemptsAndNoNegativeCaching")
        void getCookies_solveAlwaysFails_errorAfterMaxAttemptsAndNoNegativeCaching() {
            when(session.solve(primary)).thenThrow(
                    new SessionException(SessionFailureReason.CHALLENGE_TIMEOUT, "timed out"));

            assertThatThrownBy(() -> cache.getCookies(primary))
                    .isInstanceOf(ChallengeCacheException.class)
                    .hasMessageContaining("after 2 attempts");
            verify(session, times(2)).solve(primary);

            assertThatThrownBy(() -> cache.getCookies(primary)).isInstanceOf(ChallengeCacheException.class);
            verify(session, times(4)).solve(primary);

            ChallengeCacheStatus status = cache.status(primary);
            assertThat(status.getFailedSolves()).isEqualTo(2);
            assertThat(status.getLastError()).contains("timed out");
            assertThat(status.getState()).isEqualTo(ChallengeState.EMPTY);
        }

        @Test
        @DisplayName("getCookies_firstAttemptFails_secondAttemptCached")
        void getCookies_firstAttemptFails_secondAttemptCached() {
            when(session.solve(primary))
                    .thenThrow(new SessionException(SessionFailureReason.EXTRACTION_FAILED, "missing acw_tc"))
                    .thenReturn(FIRST);

            assertThat(cache.getCookies(primary)).isEqualTo(FIRST);
            assertThat(cache.status(primary).getLastError()).isNull();
        }
    }

    @Nested
    @DisplayName("refresh window")
    class RefreshWindow {

        @BeforeEach
        void solveAtT0() {
            when(session.solve(primary)).thenReturn(FIRST, SECOND);
            cache.getCookies(primary);
        }

        @Test
        @DisplayName("justBeforeWindow_noRefreshStarted")
        void justBeforeWindow_noRefreshStarted() {
            clock.set(T0.plus(TTL).minus(WINDOW).minusSeconds(1));

            assertThat(cache.getCookies(primary)).isEqualTo(FIRST);
            assertThat(queuedRefreshes).isEmpty();
        }

        @Test
        @DisplayName("atWindowStart_servesCurrentAndStartsOneBackgroundRefresh")
        void atWindowStart_servesCurrentAndStartsOneBackgroundRefresh() {
            clock.set(T0.plus(TTL).minus(WINDOW));

            assertThat(cache.getCookies(primary)).isEqualTo(FIRST);
            assertThat(cache.getCookies(primary)).isEqualTo(FIRST);
            assertThat(queuedRefreshes).hasSize(1);
            assertThat(cache.status(primary).getState()).isEqualTo(ChallengeState.REFRESHING);

            runQueuedRefreshes();

            assertThat(cache.getCookies(primary)).isEqualTo(SECOND);
            verify(session, times(2)).solve(primary);
            assertThat(cache.status(primary).getSolvedAt()).isEqualTo(T0.plus(TTL).minus(WINDOW));
        }

        @Test
        @DisplayName("afterExpiry_blocksOnForegroundSolve")
        void afterExpiry_blocksOnForegroundSolve() {
            clock.set(T0.plus(TTL).plusSeconds(1));

            assertThat(cache.getCookies(primary)).isEqualTo(SECOND);
            assertThat(queuedRefreshes).isEmpty();
            verify(session, times(2)).solve(primary);
        }

        @Test
        @DisplayName("backgroundRefreshFails_keepsServingUntilExpiry")
        void backgroundRefreshFails_keepsServingUntilExpiry() {
            reset(session);
            when(session.solve(primary)).thenThrow(new SessionException(SessionFailureReason.CRASHED, "gone"));
            clock.set(T0.plus(TTL).minus(Duration.ofMinutes(5)));

            cache.getCookies(primary);
            runQueuedRefreshes();

            assertThat(cache.getCookies(primary)).isEqualTo(FIRST);
            assertThat(cache.status(primary).getState()).isIn(ChallengeState.EXPIRING, ChallengeState.REFRESHING);
            assertThat(cache.status(primary).getFailedSolves()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("invalidate / refreshNow / peek")
    class Invalidation {

        @Test
        @DisplayName("invalidate_nextCallSolvesAgain")
        void invalidate_nextCallSolvesAgain() {
            when(session.solve(primary)).thenReturn(FIRST, SECOND);
            cache.getCookies(primary);

            cache.invalidate(primary);

            assertThat(cache.peekValidCookies(primary)).isEmpty();
            assertThat(cache.getCookies(primary)).isEqualTo(SECOND);
        }

        @Test
        @DisplayName("refreshNow_replacesEntryAndReportsTtl")
        void refreshNow_replacesEntryAndReportsTtl() {
            when(session.solve(primary)).thenReturn(FIRST, SECOND);
            cache.getCookies(primary);
            clock.advance(Duration.ofMinutes(20));

            ChallengeCacheStatus status = cache.refreshNow(primary);

            assertThat(status.getState()).isEqualTo(ChallengeState.VALID);
            assertThat(status.getTtlSeconds()).isEqualTo(TTL.getSeconds());
            assertThat(status.getCookieNames()).containsExactlyInAnyOrderElementsOf(SECOND.keySet());
        }

        @Test
        @DisplayName("peekValidCookies_neverSolves")
        void peekValidCookies_neverSolves() {
            assertThat(cache.peekValidCookies(primary)).isEmpty();
            verify(session, never()).solve(any());
        }

        @Test
        @DisplayName("status_siteWithoutChallenge_notRequired")
        void status_siteWithoutChallenge_notRequired() {
            assertThat(cache.status(TestFixtures.backup(1)).getState()).isEqualTo(ChallengeState.NOT_REQUIRED);
        }
    }
}
