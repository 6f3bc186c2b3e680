package com.mouse.keeper.service;

import com.mouse.keeper.config.KeeperProperties;
import com.mouse.keeper.config.UpstreamClients;
import com.mouse.keeper.model.Account;
import com.mouse.keeper.model.InboundRequest;
import com.mouse.keeper.model.Site;
import com.mouse.keeper.model.UpstreamResponse;
import com.mouse.keeper.utils.CookieUtils;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Sends one inbound request to one site with one account's credentials.
 */
@Slf4j
@Service
public class UpstreamForwarder {

    /** Headers that describe the inbound hop or carry the caller's own credentials. */
    private static final Set<String> DROPPED_HEADERS = Set.of(
            "host", "content-length", "connection", "keep-alive", "proxy-connection", "proxy-authorization",
            "proxy-authenticate", "te", "trailer", "transfer-encoding", "upgrade",
            "authorization", "x-api-key", "cookie");

    private static final Set<String> BODY_REQUIRED = Set.of("POST", "PUT", "PATCH");

    private final UpstreamClients clients;
    private final String apiUserHeader;

    public UpstreamForwarder(UpstreamClients clients, KeeperProperties properties) {
        this.clients = clients;
        this.apiUserHeader = properties.getRouter().getApiUserHeader();
    }

    /**
     * @return the open upstream response; the caller owns it and must close it
     * @throws IOException on connection failure or timeout
     */
    public UpstreamResponse forward(Site site, Account account, Map<String, String> challengeCookies,
                                    InboundRequest inbound) throws IOException {
        Request request = buildRequest(site, account, challengeCookies, inbound);
        log.debug("Forwarding {} {} to {} as {}", inbound.getMethod(), inbound.getPath(), site.getName(),
                account.getName());
        Response response = clients.forSite(site).newCall(request).execute();
        return new UpstreamResponse(response, site, account.getName());
    }

    Request buildRequest(Site site, Account account, Map<String, String> challengeCookies, InboundRequest inbound) {
        String target = site.resolve(inbound.getPath());
        if (inbound.getQuery() != null && !inbound.getQuery().isEmpty()) {
            target = target + "?" + inbound.getQuery();
        }
        HttpUrl url = HttpUrl.get(target);

        Request.Builder builder = new Request.Builder().url(url);
        for (Map.Entry<String, List<String>> header : inbound.getHeaders().entrySet()) {
            if (DROPPED_HEADERS.contains(header.getKey().toLowerCase(Locale.ROOT))) {
                continue;
            }
            for (String value : header.getValue()) {
                builder.addHeader(header.getKey(), value);
            }
        }

        builder.header("Authorization", "Bearer " + account.getApiKey());
        builder.header("x-api-key", account.getApiKey());
        if (account.getApiUser() != null && !account.getApiUser().isBlank()) {
            builder.header(apiUserHeader, account.getApiUser());
        }

        String cookieHeader = CookieUtils.formatCookieHeader(CookieUtils.merge(account.getCookies(), challengeCookies));
        if (!cookieHeader.isEmpty()) {
            builder.header("Cookie", cookieHeader);
        }

        builder.method(inbound.getMethod(), bodyOf(inbound));
        return builder.build();
    }

    private static RequestBody bodyOf(InboundRequest inbound) {
        String method = inbound.getMethod();
        boolean bodyless = "GET".equalsIgnoreCase(method) || "HEAD".equalsIgnoreCase(method);
        if (inbound.hasBody() && !bodyless) {
            String contentType = inbound.firstHeader("Content-Type");
            return RequestBody.create(inbound.getBody(), contentType != null ? MediaType.parse(contentType) : null);
        }
        if (BODY_REQUIRED.contains(method.toUpperCase(Locale.ROOT))) {
            return RequestBody.create(new byte[0], null);
        }
        return null;
    }
}
