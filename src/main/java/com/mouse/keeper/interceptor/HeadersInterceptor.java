package com.mouse.keeper.interceptor;

import lombok.RequiredArgsConstructor;
import okhttp3.Interceptor;
import okhttp3.Request;

import java.io.IOException;
import java.util.Map;

/**
 * Fills in browser-like defaults for headers the request does not already carry.
 */
@RequiredArgsConstructor
public class HeadersInterceptor implements Interceptor {

    private final String userAgent;
    private final Map<String, String> defaults;

    @Override
    public okhttp3.Response intercept(Interceptor.Chain chain) throws IOException {
        Request original = chain.request();
        Request.Builder builder = original.newBuilder();

        if (original.header("User-Agent") == null) {
            builder.header("User-Agent", userAgent);
        }
        defaults.forEach((key, value) -> {
            if (original.header(key) == null) {
                builder.header(key, value);
            }
        });

        return chain.proceed(builder.build());
    }
}
