package com.mouse.keeper.interceptor;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Logs each outbound call with its time to headers. The body is left untouched so
 * streamed responses reach the client as they arrive.
 */
@Slf4j
public class SimpleHttpLoggingInterceptor implements Interceptor {

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        log.debug("→ {} {}", request.method(), request.url());

        long startNs = System.nanoTime();
        Response response;
        try {
            response = chain.proceed(request);
        } catch (IOException e) {
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
            log.warn("← {} {} FAILED after {}ms: {}", request.method(), request.url().host(), elapsedMs, e.getMessage());
            throw e;
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        log.info("← {} {} {}{} | Headers after: {}ms | Type: {}",
                response.code(),
                request.method(),
                request.url().host(),
                request.url().encodedPath(),
                elapsedMs,
                response.header("Content-Type", "-"));
        return response;
    }
}
