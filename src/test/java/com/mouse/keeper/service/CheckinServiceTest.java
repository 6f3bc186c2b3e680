package com.mouse.keeper.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.keeper.config.KeeperProperties;
import com.mouse.keeper.config.SiteCatalog;
import com.mouse.keeper.config.UpstreamClients;
import com.mouse.keeper.enums.SiteRole;
import com.mouse.keeper.exception.ChallengeCacheException;
import com.mouse.keeper.model.Account;
import com.mouse.keeper.model.CheckinResult;
import com.mouse.keeper.model.CheckinStatus;
import com.mouse.keeper.model.Site;
import com.mouse.keeper.repository.AccountRepository;
import com.mouse.keeper.support.MutableClock;
import com.mouse.keeper.support.TestFixtures;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class CheckinServiceTest {

    private static final String JSON = "application/json";

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private ChallengeCookieCache cookieCache;

    private MockWebServer primaryServer;
    private MockWebServer backupServer;
    private Site primary;
    private Site backup;
    private KeeperProperties properties;
    private CheckinService service;

    @BeforeEach
    void setUp() throws IOException {
        primaryServer = new MockWebServer();
        backupServer = new MockWebServer();
        primaryServer.start();
        backupServer.start();

        primary = Site.builder().name("primary").url(primaryServer.url("/").toString())
                .role(SiteRole.PRIMARY).requiresChallenge(true).challengePath("/login").build();
        backup = Site.builder().name("backup-1").url(backupServer.url("/").toString())
                .role(SiteRole.BACKUP).priority(1).build();

        properties = TestFixtures.properties();
        OkHttpClient client = new OkHttpClient.Builder().retryOnConnectionFailure(false).build();
        service = new CheckinService(accountRepository, new SiteCatalog(List.of(primary, backup)), cookieCache,
                new UpstreamClients(client, client), new ObjectMapper(), properties,
                new MutableClock(Instant.parse("2026-01-01T00:00:00Z")));
    }

    @AfterEach
    void tearDown() throws IOException {
        primaryServer.shutdown();
        backupServer.shutdown();
    }

    private static MockResponse json(String body) {
        return new MockResponse().setResponseCode(200).setHeader("Content-Type", JSON).setBody(body);
    }

    @Nested
    @DisplayName("checkin")
    class Checkin {

        @Test
        @DisplayName("checkin_primarySucceeds_sendsSessionAndChallengeCookies")
        void checkin_primarySucceeds_sendsSessionAndChallengeCookies() throws Exception {
            when(cookieCache.getCookies(primary)).thenReturn(Map.of("acw_tc", "tc"));
            primaryServer.enqueue(json("{\"ret\":1,\"msg\":\"签到成功\"}"));

            CheckinResult result = service.checkin(TestFixtures.account("a"), new LinkedHashMap<>());

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getSiteUsed()).isEqualTo("primary");
            assertThat(result.getMessage()).isEqualTo("签到成功");

            RecordedRequest recorded = primaryServer.takeRequest();
            assertThat(recorded.getMethod()).isEqualTo("POST");
            assertThat(recorded.getPath()).isEqualTo("/api/user/sign_in");
            assertThat(recorded.getHeader("Cookie")).contains("acw_tc=tc").contains("session=sess-a");
            assertThat(recorded.getHeader("new-api-user")).isEqualTo("100");
        }

        @Test
        @DisplayName("checkin_primaryReturnsChallengePage_fallsBackToBackup")
        void checkin_primaryReturnsChallengePage_fallsBackToBackup() {
            when(cookieCache.getCookies(primary)).thenReturn(Map.of());
            primaryServer.enqueue(new MockResponse().setResponseCode(200)
                    .setHeader("Content-Type", "text/html").setBody("<html></html>"));
            backupServer.enqueue(json("{\"success\":true,\"message\":\"ok\"}"));

            CheckinResult result = service.checkin(TestFixtures.account("a"), new LinkedHashMap<>());

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getSiteUsed()).isEqualTo("backup-1");
        }

        @Test
        @DisplayName("checkin_alreadyCheckedIn_countsAsSuccess")
        void checkin_alreadyCheckedIn_countsAsSuccess() {
            when(cookieCache.getCookies(primary)).thenReturn(Map.of());
            primaryServer.enqueue(json("{\"success\":false,\"message\":\"今天已签到\"}"));

            assertThat(service.checkin(TestFixtures.account("a"), new LinkedHashMap<>()).isSuccess()).isTrue();
        }

        @Test
        @DisplayName("checkin_challengeUnavailable_stillTriesWithSessionOnly")
        void checkin_challengeUnavailable_stillTriesWithSessionOnly() throws Exception {
            when(cookieCache.getCookies(primary)).thenThrow(new ChallengeCacheException("primary", "no browser", null));
            primaryServer.enqueue(json("{\"code\":0}"));

            assertThat(service.checkin(TestFixtures.account("a"), new LinkedHashMap<>()).isSuccess()).isTrue();
            assertThat(primaryServer.takeRequest().getHeader("Cookie")).isEqualTo("session=sess-a");
        }

        @Test
        @DisplayName("checkin_everySiteFails_failureWithLastMessage")
        void checkin_everySiteFails_failureWithLastMessage() {
            when(cookieCache.getCookies(primary)).thenReturn(Map.of());
            primaryServer.enqueue(new MockResponse().setResponseCode(500));
            backupServer.enqueue(json("{\"success\":false,\"message\":\"session expired\"}"));

            CheckinResult result = service.checkin(TestFixtures.account("a"), new LinkedHashMap<>());

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getMessage()).isEqualTo("session expired");
        }

        @Test
        @DisplayName("checkin_missingSessionCookie_failsWithoutRequest")
        void checkin_missingSessionCookie_failsWithoutRequest() {
            Account noSession = TestFixtures.account("a").toBuilder().cookies(new LinkedHashMap<>()).build();

            CheckinResult result = service.checkin(noSession, new LinkedHashMap<>());

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getMessage()).isEqualTo("Missing session cookie");
            assertThat(primaryServer.getRequestCount()).isZero();
            verifyNoInteractions(cookieCache);
        }
    }

    @Test
    @DisplayName("runAll_skipsDisabledAccountsAndSolvesChallengeOncePerRun")
    void runAll_skipsDisabledAccountsAndSolvesChallengeOncePerRun() {
        when(accountRepository.findAll()).thenReturn(List.of(
                TestFixtures.account("a"),
                TestFixtures.account("b"),
                TestFixtures.account("off").toBuilder().enabled(false).build()));
        when(cookieCache.getCookies(primary)).thenReturn(Map.of("acw_tc", "tc"));
        primaryServer.enqueue(json("{\"ret\":1}"));
        primaryServer.enqueue(json("{\"ret\":1}"));

        List<CheckinResult> results = service.runAll();

        assertThat(results).extracting(CheckinResult::getAccount).containsExactly("a", "b");
        verify(cookieCache, times(1)).getCookies(primary);

        CheckinStatus status = service.status();
        assertThat(status.getTotalSuccess()).isEqualTo(2);
        assertThat(status.getLastRun()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
        assertThat(status.isRunning()).isFalse();
    }

    @Test
    @DisplayName("nextRunAfter_followsCronInLocalZone")
    void nextRunAfter_followsCronInLocalZone() {
        ZoneId zone = ZoneId.systemDefault();
        Instant from = ZonedDateTime.of(2026, 3, 10, 3, 0, 0, 0, zone).toInstant();

        assertThat(service.nextRunAfter(from)).isEqualTo(ZonedDateTime.of(2026, 3, 10, 8, 30, 0, 0, zone).toInstant());
    }
}
