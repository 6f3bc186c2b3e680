package com.mouse.keeper.service;

import com.mouse.keeper.config.UpstreamClients;
import com.mouse.keeper.enums.SiteRole;
import com.mouse.keeper.model.Account;
import com.mouse.keeper.model.InboundRequest;
import com.mouse.keeper.model.Site;
import com.mouse.keeper.model.UpstreamResponse;
import com.mouse.keeper.support.TestFixtures;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class UpstreamForwarderTest {

    private MockWebServer server;
    private UpstreamForwarder forwarder;
    private Account account;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        OkHttpClient client = new OkHttpClient.Builder().retryOnConnectionFailure(false).build();
        forwarder = new UpstreamForwarder(new UpstreamClients(client, client), TestFixtures.properties());
        account = TestFixtures.account("a");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static InboundRequest.InboundRequestBuilder inbound(String method) {
        return InboundRequest.builder()
                .method(method)
                .path("/v1/messages")
                .header("Authorization", List.of("Bearer caller-key"))
                .header("x-api-key", List.of("caller-key"))
                .header("Cookie", List.of("tracking=1"))
                .header("Host", List.of("gateway.local"))
                .header("Connection", List.of("keep-alive"))
                .header("anthropic-version", List.of("2023-06-01"));
    }

    @Nested
    @DisplayName("buildRequest")
    class BuildRequest {

        @Test
        @DisplayName("buildRequest_replacesCallerCredentialsWithAccount")
        void buildRequest_replacesCallerCredentialsWithAccount() {
            Request request = forwarder.buildRequest(TestFixtures.primary(), account,
                    Map.of("acw_tc", "tc"), inbound("GET").query("beta=true").build());

            assertThat(request.url().toString()).isEqualTo("https://primary.example/v1/messages?beta=true");
            assertThat(request.headers("Authorization")).containsExactly("Bearer sk-a");
            assertThat(request.headers("x-api-key")).containsExactly("sk-a");
            assertThat(request.header("new-api-user")).isEqualTo("100");
            assertThat(request.header("anthropic-version")).isEqualTo("2023-06-01");
            assertThat(request.header("Host")).isNull();
            assertThat(request.header("Connection")).isNull();
            assertThat(request.headers("Cookie")).containsExactly("session=sess-a; acw_tc=tc");
            assertThat(request.body()).isNull();
        }

        @Test
        @DisplayName("buildRequest_challengeCookieWinsOverAccountCookieOfSameName")
        void buildRequest_challengeCookieWinsOverAccountCookieOfSameName() {
            Account withClash = account.toBuilder().cookies(Map.of("acw_tc", "stale")).build();

            Request request = forwarder.buildRequest(TestFixtures.primary(), withClash,
                    Map.of("acw_tc", "fresh"), inbound("GET").build());

            assertThat(request.header("Cookie")).isEqualTo("acw_tc=fresh");
        }

        @Test
        @DisplayName("buildRequest_postWithoutBody_sendsEmptyBody")
        void buildRequest_postWithoutBody_sendsEmptyBody() throws IOException {
            Request request = forwarder.buildRequest(TestFixtures.backup(1), account, Map.of(), inbound("POST").build());

            assertThat(request.body()).isNotNull();
            assertThat(request.body().contentLength()).isZero();
        }

        @Test
        @DisplayName("buildRequest_postWithBody_keepsBytesAndContentType")
        void buildRequest_postWithBody_keepsBytesAndContentType() throws IOException {
            byte[] payload = "{\"stream\":true}".getBytes(StandardCharsets.UTF_8);
            Request request = forwarder.buildRequest(TestFixtures.backup(1), account, Map.of(),
                    inbound("POST").header("Content-Type", List.of("application/json")).body(payload).build());

            Buffer buffer = new Buffer();
            request.body().writeTo(buffer);
            assertThat(buffer.readUtf8()).isEqualTo("{\"stream\":true}");
            assertThat(request.body().contentType().toString()).startsWith("application/json");
        }
    }

    @Test
    @DisplayName("forward_returnsOpenResponseFromSite")
    void forward_returnsOpenResponseFromSite() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200)
                .setHeader("Content-Type", "text/event-stream")
                .setBody("data: hello\n\n"));
        Site site = Site.builder()
                .name("local")
                .url(server.url("/").toString())
                .role(SiteRole.BACKUP)
                .build();

        try (UpstreamResponse response = forwarder.forward(site, account, Map.of(),
                inbound("POST").body("{}".getBytes(StandardCharsets.UTF_8)).build())) {
            assertThat(response.status()).isEqualTo(200);
            assertThat(response.getAccountName()).isEqualTo("a");
            assertThat(response.body().string()).isEqualTo("data: hello\n\n");
        }

        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getPath()).isEqualTo("/v1/messages");
        assertThat(recorded.getHeader("Authorization")).isEqualTo("Bearer sk-a");
        assertThat(recorded.getBody().readUtf8()).isEqualTo("{}");
    }
}
