package com.mouse.keeper.service;

import com.mouse.keeper.config.KeeperProperties;
import com.mouse.keeper.config.UpstreamClients;
import com.mouse.keeper.interfaces.SiteProbe;
import com.mouse.keeper.model.ProbeResult;
import com.mouse.keeper.model.Site;
import com.mouse.keeper.utils.CookieUtils;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;

/**
 * HEAD request against the probe path of a site. Reuses challenge cookies that are already
 * cached but never triggers a solve.
 * <p>
 * An HTML answer means the protection layer intercepted the call. Any other status below
 * 500 means the site is serving.
 */
@Slf4j
@Service
public class PrimaryHealthProber implements SiteProbe {

    private final OkHttpClient directProbeClient;
    private final OkHttpClient proxiedProbeClient;
    private final ChallengeCookieCache cookieCache;
    private final String probePath;

    public PrimaryHealthProber(UpstreamClients clients, ChallengeCookieCache cookieCache, KeeperProperties properties) {
        KeeperProperties.Failover failover = properties.getFailover();
        this.directProbeClient = probeClient(clients.direct(), failover);
        this.proxiedProbeClient = probeClient(clients.proxied(), failover);
        this.cookieCache = cookieCache;
        this.probePath = failover.getProbePath();
    }

    @Override
    public ProbeResult probe(Site site) {
        Request.Builder builder = new Request.Builder()
                .url(site.resolve(probePath))
                .head();
        if (site.isRequiresChallenge()) {
            Map<String, String> cookies = cookieCache.peekValidCookies(site).orElse(Map.of());
            if (!cookies.isEmpty()) {
                builder.header("Cookie", CookieUtils.formatCookieHeader(cookies));
            }
        }

        OkHttpClient client = site.isRequiresProxy() ? proxiedProbeClient : directProbeClient;
        try (Response response = client.newCall(builder.build()).execute()) {
            String contentType = response.header("Content-Type", "");
            if (contentType.toLowerCase(Locale.ROOT).contains("text/html")) {
                log.debug("Probe of {} hit the challenge page", site.getName());
                return ProbeResult.unhealthy("challenge_page");
            }
            if (response.code() < 500) {
                return ProbeResult.healthy();
            }
            return ProbeResult.unhealthy("error_" + response.code());
        } catch (IOException | RuntimeException e) {
            log.debug("Probe of {} failed: {}", site.getName(), e.getMessage());
            return ProbeResult.unhealthy("error: " + e.getClass().getSimpleName() + " " + e.getMessage());
        }
    }

    private static OkHttpClient probeClient(OkHttpClient base, KeeperProperties.Failover failover) {
        return base.newBuilder()
                .connectTimeout(failover.getProbeConnectTimeout())
                .readTimeout(failover.getProbeReadTimeout())
                .followRedirects(true)
                .followSslRedirects(true)
                .build();
    }
}
