package com.mouse.keeper.config;

import com.mouse.keeper.interceptor.HeadersInterceptor;
import com.mouse.keeper.interceptor.SimpleHttpLoggingInterceptor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetSocketAddress;
import java.net.Proxy;
import java.util.Map;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
public class HttpClientConfig {

    /**
     * Clients used for forwarding and probing. Redirects are handed back to the caller,
     * and compression is left to whatever the caller negotiated.
     */
    @Bean
    public UpstreamClients upstreamClients(KeeperProperties properties) {
        KeeperProperties.Router router = properties.getRouter();
        OkHttpClient direct = new OkHttpClient.Builder()
                .connectTimeout(router.getConnectTimeout())
                .readTimeout(router.getReadTimeout())
                .writeTimeout(router.getWriteTimeout())
                .connectionPool(new ConnectionPool(20, 5, TimeUnit.MINUTES))
                .followRedirects(false)
                .followSslRedirects(false)
                .retryOnConnectionFailure(false)
                .addInterceptor(new HeadersInterceptor(properties.getChallenge().getUserAgent(), Map.of()))
                .addInterceptor(new SimpleHttpLoggingInterceptor())
                .build();

        OkHttpClient proxied = direct;
        KeeperProperties.Proxy proxy = properties.getProxy();
        if (proxy.isConfigured()) {
            proxied = direct.newBuilder()
                    .proxy(new Proxy(Proxy.Type.HTTP, new InetSocketAddress(proxy.getHost(), proxy.getPort())))
                    .build();
            log.info("Upstream proxy configured at {}", proxy.url());
        }
        return new UpstreamClients(direct, proxied);
    }

    /**
     * Client for everything that is not upstream API traffic: check-in, key validation, alerts.
     */
    @Bean
    public OkHttpClient okHttpClient(KeeperProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS)
                .addInterceptor(new HeadersInterceptor(properties.getChallenge().getUserAgent(),
                        Map.of("Accept", "application/json, text/plain, */*")))
                .addInterceptor(new SimpleHttpLoggingInterceptor())
                .build();
    }
}
