package com.mouse.keeper.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.keeper.config.KeeperProperties;
import com.mouse.keeper.config.SiteCatalog;
import com.mouse.keeper.config.UpstreamClients;
import com.mouse.keeper.exception.ChallengeCacheException;
import com.mouse.keeper.model.Account;
import com.mouse.keeper.model.CheckinResult;
import com.mouse.keeper.model.CheckinStatus;
import com.mouse.keeper.model.Site;
import com.mouse.keeper.repository.AccountRepository;
import com.mouse.keeper.utils.CookieUtils;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Daily sign-in for every enabled account that has a session cookie.
 * <p>
 * Sites are tried in failover order until one answers with JSON. Reads accounts only;
 * pool health is never touched.
 */
@Slf4j
@Service
public class CheckinService {

    private static final String EMOJI_OK = "✅";
    private static final String EMOJI_FAIL = "❌";
    private static final String SESSION_COOKIE = "session";

    private final AccountRepository accountRepository;
    private final SiteCatalog siteCatalog;
    private final ChallengeCookieCache cookieCache;
    private final UpstreamClients clients;
    private final ObjectMapper objectMapper;
    private final KeeperProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ExecutorService asyncExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "checkin-async");
        t.setDaemon(true);
        return t;
    });

    private volatile Instant lastRun;
    private volatile List<CheckinResult> lastResults = List.of();

    public CheckinService(AccountRepository accountRepository,
                          SiteCatalog siteCatalog,
                          ChallengeCookieCache cookieCache,
                          UpstreamClients clients,
                          ObjectMapper objectMapper,
                          KeeperProperties properties,
                          Clock clock) {
        this.accountRepository = accountRepository;
        this.siteCatalog = siteCatalog;
        this.cookieCache = cookieCache;
        this.clients = clients;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Checks in every eligible account. A call made while a run is in progress returns
     * the previous results without starting another run.
     */
    public List<CheckinResult> runAll() {
        if (!running.compareAndSet(false, true)) {
            log.info("Check-in already running, skipping");
            return lastResults;
        }
        try {
            List<Account> accounts = accountRepository.findAll().stream()
                    .filter(Account::isEnabled)
                    .toList();
            log.info("Starting check-in for {} accounts", accounts.size());

            Map<String, Map<String, String>> challengeCookies = new LinkedHashMap<>();
            List<CheckinResult> results = new ArrayList<>();
            for (Account account : accounts) {
                results.add(checkin(account, challengeCookies));
            }

            long ok = results.stream().filter(CheckinResult::isSuccess).count();
            log.info("Check-in completed: {}/{} successful", ok, results.size());
            lastResults = List.copyOf(results);
            lastRun = clock.instant();
            return lastResults;
        } finally {
            running.set(false);
        }
    }

    public void runAllAsync() {
        asyncExecutor.execute(() -> {
            try {
                runAll();
            } catch (RuntimeException e) {
                log.error("{} Async check-in failed: {}", EMOJI_FAIL, e.getMessage(), e);
            }
        });
    }

    public boolean isRunning() {
        return running.get();
    }

    public CheckinStatus status() {
        List<CheckinResult> results = lastResults;
        int ok = (int) results.stream().filter(CheckinResult::isSuccess).count();
        return CheckinStatus.builder()
                .enabled(properties.getCheckin().isEnabled())
                .running(running.get())
                .lastRun(lastRun)
                .nextRun(properties.getCheckin().isEnabled() ? nextRunAfter(clock.instant()) : null)
                .totalSuccess(ok)
                .totalFailed(results.size() - ok)
                .results(results)
                .build();
    }

    /** Next cron fire time, evaluated in the server's local zone. */
    public Instant nextRunAfter(Instant from) {
        CronExpression cron = CronExpression.parse(properties.getCheckin().getCron());
        ZonedDateTime next = cron.next(from.atZone(ZoneId.systemDefault()));
        return next != null ? next.toInstant() : null;
    }

    @PreDestroy
    public void shutdown() {
        asyncExecutor.shutdown();
        try {
            if (!asyncExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                asyncExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            asyncExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    CheckinResult checkin(Account account, Map<String, Map<String, String>> challengeCookies) {
        String session = account.getCookies() != null ? account.getCookies().get(SESSION_COOKIE) : null;
        if (session == null || session.isBlank()) {
            return result(account, false, "Missing session cookie", null);
        }
        if (account.getApiUser() == null || account.getApiUser().isBlank()) {
            return result(account, false, "Missing api_user", null);
        }

        String message = "All sites failed";
        for (Site site : siteCatalog.inFailoverOrder()) {
            Map<String, String> cookies = new LinkedHashMap<>();
            if (site.isRequiresChallenge()) {
                cookies.putAll(challengeCookies.computeIfAbsent(site.getName(), k -> challengeCookiesFor(site)));
            }
            cookies.put(SESSION_COOKIE, session);

            Request request = new Request.Builder()
                    .url(site.resolve(properties.getCheckin().getSignInPath()))
                    .header("Accept", "application/json, text/plain, */*")
                    .header("X-Requested-With", "XMLHttpRequest")
                    .header("Referer", site.getUrl())
                    .header("Origin", site.getUrl())
                    .header("Cookie", CookieUtils.formatCookieHeader(cookies))
                    .header(properties.getRouter().getApiUserHeader(), account.getApiUser())
                    .post(RequestBody.create(new byte[0], null))
                    .build();

            OkHttpClient client = clients.forSite(site).newBuilder()
                    .callTimeout(properties.getCheckin().getTimeout())
                    .build();
            try (Response response = client.newCall(request).execute()) {
                String contentType = response.header("Content-Type", "");
                if (contentType.toLowerCase(Locale.ROOT).contains("text/html")) {
                    log.warn("[{}] [{}] Challenge page on check-in, trying next site", account.getName(), site.getName());
                    continue;
                }
                if (response.code() != 200) {
                    log.warn("[{}] [{}] Check-in HTTP {}", account.getName(), site.getName(), response.code());
                    message = "HTTP " + response.code();
                    continue;
                }

                CheckinResult outcome = interpret(account, site, response.body());
                if (outcome.isSuccess()) {
                    log.info("{} [{}] [{}] {}", EMOJI_OK, account.getName(), site.getName(), outcome.getMessage());
                    return outcome;
                }
                message = outcome.getMessage();
                log.warn("[{}] [{}] Check-in failed: {}", account.getName(), site.getName(), message);
            } catch (IOException e) {
                log.warn("[{}] [{}] Connection error: {}", account.getName(), site.getName(), e.getMessage());
            }
        }

        log.error("{} [{}] Check-in failed on every site: {}", EMOJI_FAIL, account.getName(), message);
        return result(account, false, message, null);
    }

    private CheckinResult interpret(Account account, Site site, ResponseBody body) throws IOException {
        String text = body != null ? body.string() : "";
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            boolean ok = text.toLowerCase(Locale.ROOT).contains("success");
            return result(account, ok, ok ? "Check-in successful (non-JSON response)"
                    : "Invalid response format: " + abbreviate(text), site.getName());
        }
        if (root == null) {
            return result(account, false, "Empty response", site.getName());
        }

        String message = root.hasNonNull("msg") ? root.get("msg").asText()
                : root.hasNonNull("message") ? root.get("message").asText() : null;
        boolean success = root.path("ret").asInt(0) == 1
                || (root.has("code") && root.path("code").asInt(-1) == 0)
                || root.path("success").asBoolean(false);
        if (success) {
            return result(account, true, message != null ? message : "Check-in successful", site.getName());
        }
        String failure = message != null ? message : "Check-in failed";
        boolean already = failure.contains("已签到") || failure.toLowerCase(Locale.ROOT).contains("already");
        return result(account, already, failure, site.getName());
    }

    private Map<String, String> challengeCookiesFor(Site site) {
        try {
            return cookieCache.getCookies(site);
        } catch (ChallengeCacheException e) {
            log.warn("No challenge cookies for {} during check-in: {}", site.getName(), e.getMessage());
            return Map.of();
        }
    }

    private CheckinResult result(Account account, boolean success, String message, String site) {
        return CheckinResult.builder()
                .account(account.getName())
                .success(success)
                .message(message)
                .siteUsed(site)
                .timestamp(clock.instant())
                .build();
    }

    private static String abbreviate(String text) {
        return text.length() > 100 ? text.substring(0, 100) : text;
    }
}
