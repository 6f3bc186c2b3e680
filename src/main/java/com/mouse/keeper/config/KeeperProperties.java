package com.mouse.keeper.config;

import com.mouse.keeper.enums.SiteRole;
import lombok.Data;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Every recognised option of the gateway, bound from the {@code keeper.*} tree.
 * <p>
 * Validated once at startup; an invalid tree fails the context instead of
 * surfacing at the first request.
 */
@Data
@ConfigurationProperties(prefix = "keeper")
public class KeeperProperties implements InitializingBean {

    private Proxy proxy = new Proxy();
    private List<SiteProperties> sites = new ArrayList<>();
    private Challenge challenge = new Challenge();
    private Session session = new Session();
    private Failover failover = new Failover();
    private Pool pool = new Pool();
    private Router router = new Router();
    private Checkin checkin = new Checkin();
    private ApiKeyValidation apiKeyValidation = new ApiKeyValidation();
    private Alerts alerts = new Alerts();

    @Data
    public static class Proxy {
        private String host;
        private Integer port;

        public boolean isConfigured() {
            return host != null && !host.isBlank() && port != null && port > 0;
        }

        public String url() {
            return "http://" + host + ":" + port;
        }
    }

    @Data
    public static class SiteProperties {
        private String name;
        private String url;
        private SiteRole role = SiteRole.BACKUP;
        private boolean requiresProxy;
        private boolean requiresChallenge;
        /** Lower value is tried first among backups. */
        private int priority;
        private String challengePath = "/login";
    }

    @Data
    public static class Challenge {
        private Duration ttl = Duration.ofMinutes(45);
        private Duration preRefreshWindow = Duration.ofMinutes(10);
        /** Upper bound for one page load plus challenge resolution. */
        private Duration solveTimeout = Duration.ofSeconds(60);
        private Duration pageWait = Duration.ofSeconds(3);
        private int maxSolveAttempts = 2;
        private Duration refreshCheckInterval = Duration.ofMinutes(1);
        private List<String> requiredCookies = new ArrayList<>(List.of("acw_tc", "cdn_sec_tc", "acw_sc__v2"));
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    }

    @Data
    public static class Session {
        private Duration restartInterval = Duration.ofHours(6);
        private boolean headless = true;
        private Duration launchTimeout = Duration.ofMinutes(2);
    }

    @Data
    public static class Failover {
        private boolean primaryCheckEnabled = true;
        private Duration probeInterval = Duration.ofMinutes(5);
        private int recoverySuccessThreshold = 3;
        /** Consecutive site-level failures on the active site before it is abandoned. */
        private int failuresBeforeSwitch = 1;
        private String probePath = "/v1/models";
        private Duration probeConnectTimeout = Duration.ofSeconds(5);
        private Duration probeReadTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Pool {
        private String accountsFile = "data/accounts.json";
        private int failureThreshold = 3;
        private Duration cooldown = Duration.ofMinutes(5);
    }

    @Data
    public static class Router {
        private String apiPrefix = "/v1";
        private int maxAccountRetries = 3;
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration readTimeout = Duration.ofSeconds(300);
        private Duration writeTimeout = Duration.ofSeconds(30);
        private String apiUserHeader = "new-api-user";
        private Classifier classifier = new Classifier();
    }

    @Data
    public static class Classifier {
        private List<Integer> authStatusCodes = new ArrayList<>(List.of(401, 403));
        private List<Integer> rateLimitStatusCodes = new ArrayList<>(List.of(429));
        private List<String> rateLimitSignatures = new ArrayList<>(List.of("rate limit", "负载已经达到上限"));
        private List<String> quotaSignatures = new ArrayList<>(List.of("insufficient_quota", "quota exceeded", "额度不足"));
        private List<String> blockSignatures = new ArrayList<>(List.of("acw_sc__v2", "captcha", "<html"));
        private boolean emptyServerErrorIsBlock = true;
    }

    @Data
    public static class Checkin {
        private boolean enabled = true;
        private String cron = "0 30 2,8,14,20 * * *";
        private String signInPath = "/api/user/sign_in";
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class ApiKeyValidation {
        private boolean enabled;
        private String newApiUrl = "http://new-api:3000";
        private Duration cacheTtl = Duration.ofMinutes(5);
        private long maxCacheSize = 10_000;
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Alerts {
        private Telegram telegram = new Telegram();
    }

    @Data
    public static class Telegram {
        private boolean enabled;
        private String botToken;
        private String chatId;
        private String apiBase = "https://api.telegram.org";
    }

    @Override
    public void afterPropertiesSet() {
        validate();
    }

    public void validate() {
        if (sites == null || sites.isEmpty()) {
            throw new IllegalStateException("keeper.sites must define at least the primary site");
        }

        long primaries = sites.stream().filter(s -> s.getRole() == SiteRole.PRIMARY).count();
        if (primaries != 1) {
            throw new IllegalStateException("keeper.sites must contain exactly one PRIMARY site, found " + primaries);
        }

        Set<String> names = new HashSet<>();
        Set<String> urls = new HashSet<>();
        boolean anyChallenge = false;
        for (int i = 0; i < sites.size(); i++) {
            SiteProperties site = sites.get(i);
            String prefix = "keeper.sites[" + i + "]";
            requireText(site.getName(), prefix + ".name");
            requireText(site.getUrl(), prefix + ".url");
            if (!site.getUrl().startsWith("http://") && !site.getUrl().startsWith("https://")) {
                throw new IllegalStateException(prefix + ".url must be an http(s) URL: " + site.getUrl());
            }
            if (!names.add(site.getName())) {
                throw new IllegalStateException(prefix + ".name is duplicated: " + site.getName());
            }
            if (!urls.add(stripTrailingSlash(site.getUrl()))) {
                throw new IllegalStateException(prefix + ".url is duplicated: " + site.getUrl());
            }
            if ((site.isRequiresProxy() || site.isRequiresChallenge()) && !proxy.isConfigured()) {
                throw new IllegalStateException(prefix + " (" + site.getName()
                        + ") requires the proxy but keeper.proxy.host/port are not set");
            }
            if (site.isRequiresChallenge()) {
                anyChallenge = true;
                requireText(site.getChallengePath(), prefix + ".challenge-path");
            }
        }

        requirePositive(challenge.getTtl(), "keeper.challenge.ttl");
        requirePositive(challenge.getSolveTimeout(), "keeper.challenge.solve-timeout");
        requirePositive(challenge.getRefreshCheckInterval(), "keeper.challenge.refresh-check-interval");
        if (challenge.getPreRefreshWindow() == null || challenge.getPreRefreshWindow().isNegative()
                || challenge.getPreRefreshWindow().compareTo(challenge.getTtl()) >= 0) {
            throw new IllegalStateException("keeper.challenge.pre-refresh-window must be >= 0 and shorter than keeper.challenge.ttl");
        }
        if (challenge.getMaxSolveAttempts() < 1) {
            throw new IllegalStateException("keeper.challenge.max-solve-attempts must be >= 1");
        }
        if (anyChallenge && (challenge.getRequiredCookies() == null || challenge.getRequiredCookies().isEmpty())) {
            throw new IllegalStateException("keeper.challenge.required-cookies must not be empty when a site requires a challenge");
        }

        requirePositive(session.getRestartInterval(), "keeper.session.restart-interval");
        requirePositive(failover.getProbeInterval(), "keeper.failover.probe-interval");
        requirePositive(failover.getProbeConnectTimeout(), "keeper.failover.probe-connect-timeout");
        requirePositive(failover.getProbeReadTimeout(), "keeper.failover.probe-read-timeout");
        if (failover.getRecoverySuccessThreshold() < 1) {
            throw new IllegalStateException("keeper.failover.recovery-success-threshold must be >= 1");
        }
        if (failover.getFailuresBeforeSwitch() < 1) {
            throw new IllegalStateException("keeper.failover.failures-before-switch must be >= 1");
        }

        requireText(pool.getAccountsFile(), "keeper.pool.accounts-file");
        if (pool.getFailureThreshold() < 1) {
            throw new IllegalStateException("keeper.pool.failure-threshold must be >= 1");
        }
        requirePositive(pool.getCooldown(), "keeper.pool.cooldown");

        if (router.getMaxAccountRetries() < 1) {
            throw new IllegalStateException("keeper.router.max-account-retries must be >= 1");
        }
        if (router.getApiPrefix() == null || !router.getApiPrefix().startsWith("/")) {
            throw new IllegalStateException("keeper.router.api-prefix must start with '/'");
        }
        requirePositive(router.getConnectTimeout(), "keeper.router.connect-timeout");
        requirePositive(router.getReadTimeout(), "keeper.router.read-timeout");
        requirePositive(router.getWriteTimeout(), "keeper.router.write-timeout");
        requireText(router.getApiUserHeader(), "keeper.router.api-user-header");

        if (checkin.isEnabled()) {
            requireText(checkin.getCron(), "keeper.checkin.cron");
        }
        if (apiKeyValidation.isEnabled()) {
            requireText(apiKeyValidation.getNewApiUrl(), "keeper.api-key-validation.new-api-url");
            requirePositive(apiKeyValidation.getCacheTtl(), "keeper.api-key-validation.cache-ttl");
            if (apiKeyValidation.getMaxCacheSize() <= 0) {
                throw new IllegalStateException("keeper.api-key-validation.max-cache-size must be positive");
            }
        }
        if (alerts.getTelegram().isEnabled()) {
            requireText(alerts.getTelegram().getBotToken(), "keeper.alerts.telegram.bot-token");
            requireText(alerts.getTelegram().getChatId(), "keeper.alerts.telegram.chat-id");
        }
    }

    private static void requireText(String value, String option) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(option + " is required");
        }
    }

    private static void requirePositive(Duration value, String option) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalStateException(option + " must be a positive duration");
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
