package com.mouse.keeper.controller;

import com.mouse.keeper.enums.GatewayErrorReason;
import com.mouse.keeper.exception.ApiKeyRejectedException;
import com.mouse.keeper.exception.GatewayException;
import com.mouse.keeper.model.InboundRequest;
import com.mouse.keeper.model.UpstreamResponse;
import com.mouse.keeper.service.ApiKeyValidationService;
import com.mouse.keeper.service.GatewayRouter;
import com.mouse.keeper.support.TestFixtures;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
public class ProxyControllerTest {

    @Mock
    private GatewayRouter router;

    @Mock
    private ApiKeyValidationService apiKeyValidation;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new ProxyController(router, apiKeyValidation))
                .setControllerAdvice(new GlobalExceptionHandler())
                .addPlaceholderValue("keeper.router.api-prefix", "/v1")
                .build();
    }

    private static UpstreamResponse upstream(int code, String contentType, String body) {
        Response raw = new Response.Builder()
                .request(new Request.Builder().url("https://backup1.example/v1/messages").build())
                .protocol(Protocol.HTTP_1_1)
                .code(code)
                .message("OK")
                .header("Content-Type", contentType)
                .header("Transfer-Encoding", "chunked")
                .header("x-request-id", "req-1")
                .body(ResponseBody.create(body, MediaType.get(contentType)))
                .build();
        return new UpstreamResponse(raw, TestFixtures.backup(1), "a");
    }

    @Test
    @DisplayName("forward_streamsUpstreamBodyAndDropsHopByHopHeaders")
    void forward_streamsUpstreamBodyAndDropsHopByHopHeaders() throws Exception {
        when(apiKeyValidation.isEnabled()).thenReturn(false);
        when(router.route(any())).thenReturn(upstream(200, "text/event-stream", "data: hello\n\n"));

        MvcResult started = mvc.perform(post("/v1/messages?beta=true")
                        .header("x-api-key", "caller")
                        .contentType("application/json")
                        .content("{\"stream\":true}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andExpect(header().string("x-request-id", "req-1"))
                .andExpect(header().doesNotExist("Transfer-Encoding"))
                .andExpect(content().string("data: hello\n\n"));

        ArgumentCaptor<InboundRequest> captor = ArgumentCaptor.forClass(InboundRequest.class);
        verify(router).route(captor.capture());
        InboundRequest inbound = captor.getValue();
        assertThat(inbound.getMethod()).isEqualTo("POST");
        assertThat(inbound.getPath()).isEqualTo("/v1/messages");
        assertThat(inbound.getQuery()).isEqualTo("beta=true");
        assertThat(inbound.firstHeader("x-api-key")).isEqualTo("caller");
        assertThat(new String(inbound.getBody(), StandardCharsets.UTF_8)).isEqualTo("{\"stream\":true}");
    }

    @Test
    @DisplayName("forward_gatewayFailure_mappedToReasonStatus")
    void forward_gatewayFailure_mappedToReasonStatus() throws Exception {
        when(apiKeyValidation.isEnabled()).thenReturn(false);
        when(router.route(any())).thenThrow(
                new GatewayException(GatewayErrorReason.NO_ACCOUNT_AVAILABLE, "No eligible account"));

        mvc.perform(post("/v1/messages").content("{}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.reason").value("no_account_available"))
                .andExpect(jsonPath("$.path").value("/v1/messages"));
    }

    @Test
    @DisplayName("forward_challengeUnavailable_503")
    void forward_challengeUnavailable_503() throws Exception {
        when(apiKeyValidation.isEnabled()).thenReturn(false);
        when(router.route(any())).thenThrow(
                new GatewayException(GatewayErrorReason.CHALLENGE_UNAVAILABLE, "solve failed"));

        mvc.perform(post("/v1/messages").content("{}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.reason").value("challenge_unavailable"));
    }

    @Test
    @DisplayName("forward_invalidCallerKey_401WithoutRouting")
    void forward_invalidCallerKey_401WithoutRouting() throws Exception {
        when(apiKeyValidation.isEnabled()).thenReturn(true);
        doThrow(new ApiKeyRejectedException("Invalid API key")).when(apiKeyValidation).validate("bad");

        mvc.perform(post("/v1/messages").header("Authorization", "Bearer bad").content("{}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid API key"));
        verifyNoInteractions(router);
    }
}
