package com.mouse.keeper.controller;

import com.mouse.keeper.model.InboundRequest;
import com.mouse.keeper.model.UpstreamResponse;
import com.mouse.keeper.service.ApiKeyValidationService;
import com.mouse.keeper.service.GatewayRouter;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Headers;
import okhttp3.ResponseBody;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Forwards everything under the API prefix. Upstream bodies are copied through as they
 * arrive, still in their original content encoding.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ProxyController {

    private static final int CHUNK_SIZE = 8192;

    private static final Set<String> HOP_BY_HOP = Set.of(
            "connection", "keep-alive", "proxy-connection", "proxy-authenticate", "proxy-authorization",
            "te", "trailer", "transfer-encoding", "upgrade", "content-length");

    private final GatewayRouter router;
    private final ApiKeyValidationService apiKeyValidation;

    @RequestMapping("${keeper.router.api-prefix:/v1}/**")
    public ResponseEntity<StreamingResponseBody> forward(HttpServletRequest request) throws IOException {
        if (apiKeyValidation.isEnabled()) {
            apiKeyValidation.validate(ApiKeyValidationService.extractApiKey(
                    request.getHeader("x-api-key"), request.getHeader("Authorization")));
        }

        InboundRequest inbound = toInbound(request);
        UpstreamResponse upstream = router.route(inbound);

        HttpHeaders headers = new HttpHeaders();
        Headers upstreamHeaders = upstream.getResponse().headers();
        for (String name : upstreamHeaders.names()) {
            if (!HOP_BY_HOP.contains(name.toLowerCase(Locale.ROOT))) {
                headers.put(name, upstreamHeaders.values(name));
            }
        }

        StreamingResponseBody body = out -> {
            try (upstream) {
                ResponseBody responseBody = upstream.body();
                if (responseBody == null) {
                    return;
                }
                try (InputStream in = responseBody.byteStream()) {
                    byte[] buffer = new byte[CHUNK_SIZE];
                    int read;
                    while ((read = in.read(buffer)) != -1) {
                        out.write(buffer, 0, read);
                        out.flush();
                    }
                }
            } catch (IOException e) {
                log.warn("Stream from {} for account {} interrupted: {}", upstream.getSite().getName(),
                        upstream.getAccountName(), e.getMessage());
                throw e;
            }
        };

        return ResponseEntity.status(upstream.status()).headers(headers).body(body);
    }

    private static InboundRequest toInbound(HttpServletRequest request) throws IOException {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, Collections.list(request.getHeaders(name)));
        }
        byte[] body = request.getInputStream().readAllBytes();

        return InboundRequest.builder()
                .method(request.getMethod())
                .path(request.getRequestURI().substring(request.getContextPath().length()))
                .query(request.getQueryString())
                .headers(headers)
                .body(body)
                .build();
    }
}
