package me.go_gradually.liveavatar.presentation.meta.controller;

import me.go_gradually.liveavatar.application.bridge.policy.BridgePolicy;
import me.go_gradually.liveavatar.application.bridge.usecase.SessionRegistry;
import me.go_gradually.liveavatar.presentation.TestBootApplication;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = {TestBootApplication.class, MetaController.class})
@AutoConfigureMockMvc
class MetaControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BridgePolicy bridgePolicy;
    @MockBean
    private SessionRegistry sessionRegistry;

    @Test
    void config_returnsServerDefaultsWithoutExposingKey() throws Exception {
        when(bridgePolicy.defaultModel()).thenReturn("gpt-4o-realtime");
        when(bridgePolicy.defaultVoice()).thenReturn("en-US-AvaMultilingualNeural");
        when(bridgePolicy.defaultEndpoint()).thenReturn("https://res.cognitiveservices.azure.com");
        when(bridgePolicy.defaultApiKey()).thenReturn("secret");

        mockMvc.perform(get("/api/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.model").value("gpt-4o-realtime"))
                .andExpect(jsonPath("$.voice").value("en-US-AvaMultilingualNeural"))
                .andExpect(jsonPath("$.endpoint").value("https://res.cognitiveservices.azure.com"))
                .andExpect(jsonPath("$.hasApiKey").value(true))
                .andExpect(jsonPath("$.apiKey").doesNotExist());
    }

    @Test
    void config_reportsMissingKeyAndEndpoint() throws Exception {
        when(bridgePolicy.defaultModel()).thenReturn("gpt-4o-realtime");
        when(bridgePolicy.defaultVoice()).thenReturn("alloy");
        when(bridgePolicy.defaultEndpoint()).thenReturn(null);
        when(bridgePolicy.defaultApiKey()).thenReturn(" ");

        mockMvc.perform(get("/api/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.endpoint").value(""))
                .andExpect(jsonPath("$.hasApiKey").value(false));
    }

    @Test
    void health_reportsActiveSessions() throws Exception {
        when(sessionRegistry.activeSessionCount()).thenReturn(3);

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.service").value("voice-live-avatar"))
                .andExpect(jsonPath("$.activeSessions").value(3));
    }
}
