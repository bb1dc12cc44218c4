package com.demoBank.atmDemo.gateway.controller;

import com.demoBank.atmDemo.TestFixtures;
import com.demoBank.atmDemo.common.exception.AtmException;
import com.demoBank.atmDemo.common.exception.ErrorKind;
import com.demoBank.atmDemo.llm.dto.GroqApiResponse;
import com.demoBank.atmDemo.llm.service.LlmClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class AtmApiIntegrationTest {

    private static final String TOKEN = AtmController.SESSION_TOKEN_HEADER;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private LlmClient llmClient;

    @Test
    void loginThroughFinalizeAndAccounts() throws Exception {
        String token = login(TestFixtures.BOB_PAN);

        mockMvc.perform(post("/api/v1/atm/preferences").header(TOKEN, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"ClientId":"ATM-01","ClientRequestNumber":"2",
                                 "Preferences":{"Language":"ES","ReceiptPreference":"print"}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ResponseCode").value("00"))
                .andExpect(jsonPath("$.SessionLanguageCode").value("es"));

        mockMvc.perform(post("/api/v1/atm/pin").header(TOKEN, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(pinBody(TestFixtures.BOB_PIN)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.Accounts.length()").value(2))
                .andExpect(jsonPath("$.Accounts[0].AccountId").value("A3"));

        mockMvc.perform(post("/api/v1/atm/finalize").header(TOKEN, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"ClientId":"ATM-01","ClientRequestNumber":"4","ClientTransactionResult":"Completed"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ClientTransactionResult").value("COMPLETED"));

        mockMvc.perform(get("/api/v1/accounts/A3/limits").header(TOKEN, token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.withdrawal").value(500.0));

        mockMvc.perform(get("/api/v1/accounts/A1").header(TOKEN, token))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        mockMvc.perform(post("/api/v1/atm/logout").header(TOKEN, token))
                .andExpect(status().isOk());
    }

    @Test
    void wrongPinIsReportedWithTheAtmResponseCode() throws Exception {
        String token = login(TestFixtures.ALICE_PAN);
        preferences(token);

        mockMvc.perform(post("/api/v1/atm/pin").header(TOKEN, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(pinBody("9999")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("PIN_ERROR"))
                .andExpect(jsonPath("$.responseCode").value("55"))
                .andExpect(jsonPath("$.details.remainingAttempts").value(2))
                .andExpect(jsonPath("$.terminal").value(false));
    }

    @Test
    void outOfOrderPhaseIsATerminalSequenceError() throws Exception {
        String token = login(TestFixtures.ALICE_PAN);

        mockMvc.perform(post("/api/v1/atm/pin").header(TOKEN, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(pinBody(TestFixtures.ALICE_PIN)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("SEQUENCE_ERROR"))
                .andExpect(jsonPath("$.terminal").value(true));

        mockMvc.perform(post("/api/v1/atm/preferences").header(TOKEN, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"ClientId":"ATM-01","ClientRequestNumber":"2",
                                 "Preferences":{"Language":"en","ReceiptPreference":"PRINT"}}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("SEQUENCE_ERROR"));
    }

    @Test
    void unknownFieldsAndMissingTokensAreRejected() throws Exception {
        mockMvc.perform(post("/api/v1/atm/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ClientId\":\"ATM-01\",\"Surprise\":true}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        mockMvc.perform(get("/api/v1/intents"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("SEQUENCE_ERROR"));
    }

    @Test
    void chatAnswersAndEchoesTheCorrelationId() throws Exception {
        when(llmClient.complete(anyList(), anyList())).thenReturn(GroqApiResponse.builder()
                .choices(List.of(GroqApiResponse.Choice.builder()
                        .message(GroqApiResponse.Message.builder().role("assistant").content("How can I help you today?").build())
                        .build()))
                .build());
        String token = verifiedSession();

        mockMvc.perform(post("/api/v1/chat").header(TOKEN, token).header("X-Correlation-ID", "corr-42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messageText\":\"hello\"}"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Correlation-ID", "corr-42"))
                .andExpect(jsonPath("$.answer").value("How can I help you today?"))
                .andExpect(jsonPath("$.messages.length()").value(2));

        mockMvc.perform(get("/api/v1/chat/history").header(TOKEN, token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));
    }

    @Test
    void unreachableModelIsServiceUnavailable() throws Exception {
        when(llmClient.complete(anyList(), anyList()))
                .thenThrow(new AtmException(ErrorKind.LLM_UNAVAILABLE, "Model unreachable"));
        String token = verifiedSession();

        mockMvc.perform(post("/api/v1/chat").header(TOKEN, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messageText\":\"hello\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("LLM_UNAVAILABLE"));
    }

    @Test
    void structuredTransferMovesMoneyBetweenOwnAccounts() throws Exception {
        String token = verifiedSession();

        mockMvc.perform(post("/api/v1/transactions/transfer").header(TOKEN, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fromAccount\":\"A2\",\"toAccount\":\"A1\",\"amount\":10.00}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transaction.status").value("COMPLETED"))
                .andExpect(jsonPath("$.remainingLimits.accountId").value("A2"));

        mockMvc.perform(post("/api/v1/transactions/transfer").header(TOKEN, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fromAccount\":\"A2\",\"toAccount\":\"A1\",\"amount\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    private String verifiedSession() throws Exception {
        String token = login(TestFixtures.ALICE_PAN);
        preferences(token);
        mockMvc.perform(post("/api/v1/atm/pin").header(TOKEN, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(pinBody(TestFixtures.ALICE_PIN)))
                .andExpect(status().isOk());
        return token;
    }

    private String login(String pan) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/atm/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"ClientId":"ATM-01","ClientRequestNumber":"%s",
                                 "ConsumerIdentificationData":{"Track2":";%s=30121011000?"}}
                                """.formatted(UUID.randomUUID(), pan)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ResponseCode").value("00"))
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get("SessionToken").asText();
    }

    private void preferences(String token) throws Exception {
        mockMvc.perform(post("/api/v1/atm/preferences").header(TOKEN, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"ClientId":"ATM-01","ClientRequestNumber":"2",
                                 "Preferences":{"Language":"en","ReceiptPreference":"NONE"}}
                                """))
                .andExpect(status().isOk());
    }

    private static String pinBody(String pin) {
        return """
                {"ClientId":"ATM-01","ClientRequestNumber":"3","EncryptedPinData":"%s","Breadcrumb":"overview"}
                """.formatted(TestFixtures.pinBlock(pin));
    }
}
