package com.mouse.keeper.config;

import com.mouse.keeper.model.Site;
import okhttp3.OkHttpClient;

/**
 * The two outbound clients for upstream sites: one direct, one through the configured proxy.
 */
public class UpstreamClients {

    private final OkHttpClient direct;
    private final OkHttpClient proxied;

    public UpstreamClients(OkHttpClient direct, OkHttpClient proxied) {
        this.direct = direct;
        this.proxied = proxied;
    }

    public OkHttpClient forSite(Site site) {
        return site.isRequiresProxy() ? proxied : direct;
    }

    public OkHttpClient direct() {
        return direct;
    }

    public OkHttpClient proxied() {
        return proxied;
    }
}
