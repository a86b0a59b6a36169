package com.tokentracker.backend.modules.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.ZoneOffset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokentracker.backend.modules.token.domain.TokenRecord;
import com.tokentracker.backend.modules.token.infrastructure.persistence.TokenRecordRepository;
import com.tokentracker.backend.support.AbstractPostgresIntegrationTest;
import com.tokentracker.backend.support.TestAccountFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class TokenIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestAccountFactory testAccountFactory;

    @Autowired
    private TokenRecordRepository tokenRecordRepository;

    private String bearer;

    @BeforeEach
    void setUp() {
        bearer = testAccountFactory.userBearer();
    }

    @Test
    void createDerivesAmountsAndRejectsDuplicates() throws Exception {
        long id = createToken("TK-100", "2025-01-10", "Delhi", "Pending", "Asha", "Ravi", "150.00", "100.00", "90.00");

        mockMvc.perform(get("/api/tokens/{id}", id).header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token").value("TK-100"))
                .andExpect(jsonPath("$.date").value("2025-01-10"))
                .andExpect(jsonPath("$.amountDue").value(50.00))
                .andExpect(jsonPath("$.margin").value(60.00))
                .andExpect(jsonPath("$.agentPaymentApplied").value(false));

        mockMvc.perform(post("/api/tokens")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"token": "TK-100", "charges": 1}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Token already exists"));
    }

    @Test
    void updateRecalculatesAndUnknownIdIsNotFound() throws Exception {
        long id = createToken("TK-200", "2025-02-01", "Mumbai", "Pending", "Asha", "Ravi", "100", "0", "0");

        mockMvc.perform(put("/api/tokens/{id}", id)
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"token": "TK-200", "charges": 120, "paymentReceived": 20, "status": "In Progress"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.amountDue").value(100.00))
                .andExpect(jsonPath("$.margin").value(120.00))
                .andExpect(jsonPath("$.status").value("In Progress"));

        mockMvc.perform(put("/api/tokens/{id}", 987_654L)
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"token": "TK-404"}
                                """))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Token not found"));
    }

    @Test
    void deleteRemovesToken() throws Exception {
        long id = createToken("TK-300", "2025-02-01", "Pune", "Pending", null, null, "10", "0", "0");

        mockMvc.perform(delete("/api/tokens/{id}", id).header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Token deleted successfully"));
        mockMvc.perform(delete("/api/tokens/{id}", id).header("Authorization", bearer))
                .andExpect(status().isNotFound());
    }

    @Test
    void listFiltersAndOrdersByDateDescending() throws Exception {
        createToken("TK-A", "2025-01-05", "Delhi", "Pending", "Asha", "Ravi", "10", "0", "0");
        createToken("TK-B", "2025-03-01", "delhi", "completed", "Bina", "Ravi", "10", "0", "0");
        createToken("TK-C", "2025-02-10", "Mumbai", "Pending", "Asha", "Sunil", "10", "0", "0");

        mockMvc.perform(get("/api/tokens").header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(3))
                .andExpect(jsonPath("$[0].token").value("TK-B"))
                .andExpect(jsonPath("$[1].token").value("TK-C"))
                .andExpect(jsonPath("$[2].token").value("TK-A"));

        mockMvc.perform(get("/api/tokens").header("Authorization", bearer)
                        .param("location", "DELHI")
                        .param("status", "All"))
                .andExpect(jsonPath("$.length()").value(2));

        mockMvc.perform(get("/api/tokens").header("Authorization", bearer)
                        .param("status", "Completed"))
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].token").value("TK-B"));

        mockMvc.perform(get("/api/tokens").header("Authorization", bearer)
                        .param("search", "tk-c"))
                .andExpect(jsonPath("$.length()").value(1));

        mockMvc.perform(get("/api/tokens").header("Authorization", bearer)
                        .param("agent", "Asha")
                        .param("executive", "All"))
                .andExpect(jsonPath("$.length()").value(2));

        mockMvc.perform(get("/api/tokens").header("Authorization", bearer)
                        .param("fromDate", "2025-01-01")
                        .param("toDate", "2025-02-10"))
                .andExpect(jsonPath("$.length()").value(2));

        mockMvc.perform(get("/api/tokens").header("Authorization", bearer)
                        .param("fromDate", "2025-01-01"))
                .andExpect(jsonPath("$.length()").value(3));
    }

    @Test
    void bulkOperationsUpdateSelectedTokens() throws Exception {
        long first = createToken("TK-1", "2025-01-01", "Delhi", "Pending", "Asha", "Ravi", "200", "50", "80");
        long second = createToken("TK-2", "2025-01-02", "Delhi", "Pending", "Asha", "Ravi", "300", "0", "100");

        mockMvc.perform(post("/api/bulk-operations")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"operation": "apply_agent_payment", "ids": [%d, %d, 999999]}
                                """.formatted(first, second)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.processed").value(2));

        TokenRecord paid = tokenRecordRepository.findById(first).orElseThrow();
        assertThat(paid.isAgentPaymentApplied()).isTrue();
        assertThat(paid.getPaymentReceived()).isEqualByComparingTo("200");
        assertThat(paid.getAmountDue()).isEqualByComparingTo(BigDecimal.ZERO);

        mockMvc.perform(post("/api/bulk-operations")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"operation": "apply_executive_payment", "ids": [%d]}
                                """.formatted(second)))
                .andExpect(jsonPath("$.processed").value(1));

        TokenRecord executivePaid = tokenRecordRepository.findById(second).orElseThrow();
        assertThat(executivePaid.isExecutivePaymentApplied()).isTrue();
        assertThat(executivePaid.getChargesToExecutive()).isEqualByComparingTo("300");
        assertThat(executivePaid.getMargin()).isEqualByComparingTo(BigDecimal.ZERO);

        mockMvc.perform(post("/api/bulk-operations")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"operation": "mark_completed", "ids": [%d, %d]}
                                """.formatted(first, second)))
                .andExpect(jsonPath("$.processed").value(2));

        TokenRecord completed = tokenRecordRepository.findById(first).orElseThrow();
        assertThat(completed.getStatus()).isEqualTo("Completed");
        assertThat(completed.getCompletionDate()).isEqualTo(LocalDate.now(ZoneOffset.UTC));
    }

    @Test
    void bulkOperationRejectsBadInput() throws Exception {
        mockMvc.perform(post("/api/bulk-operations")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"operation": "mark_completed", "ids": []}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Operation and IDs required"));

        mockMvc.perform(post("/api/bulk-operations")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"operation": "archive_everything", "ids": [1]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown operation"));
    }

    @Test
    void lookupsAndReports() throws Exception {
        long early = createToken("TK-R1", "2025-01-01", "Delhi", "Completed", "Asha", "Ravi", "10", "0", "0");
        long late = createToken("TK-R2", "2025-01-02", "Delhi", "Completed", "Asha", "Ravi", "10", "0", "0");
        createToken("TK-R3", "2025-01-03", "Delhi", "Pending", "Bina", " ", "10", "0", "0");
        setCompletion(early, "2025-02-01");
        setCompletion(late, "2025-02-15");

        mockMvc.perform(get("/api/agents").header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0]").value("Asha"))
                .andExpect(jsonPath("$[1]").value("Bina"));

        mockMvc.perform(get("/api/executives").header("Authorization", bearer))
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0]").value("Ravi"));

        mockMvc.perform(get("/api/reports/agent").header("Authorization", bearer).param("agent", "Asha"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].token").value("TK-R1"))
                .andExpect(jsonPath("$[1].token").value("TK-R2"));

        mockMvc.perform(get("/api/reports/executive").header("Authorization", bearer).param("executive", "Ravi"))
                .andExpect(jsonPath("$[0].token").value("TK-R2"))
                .andExpect(jsonPath("$[1].token").value("TK-R1"));

        mockMvc.perform(get("/api/reports/agent").header("Authorization", bearer))
                .andExpect(status().isBadRequest());
    }

    @Test
    void exportWritesCsvWithByteOrderMark() throws Exception {
        createToken("TK-CSV", "2025-01-01", "Delhi", "Pending", "Asha, Jr.", "Ravi", "12.5", "0", "0");

        MvcResult result = mockMvc.perform(get("/api/export").header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString("tokens_export_")))
                .andExpect(header().string("Content-Disposition", containsString(".csv")))
                .andReturn();

        byte[] body = result.getResponse().getContentAsByteArray();
        assertThat(body).startsWith((byte) 0xEF, (byte) 0xBB, (byte) 0xBF);

        String csv = new String(body, 3, body.length - 3, StandardCharsets.UTF_8);
        String[] lines = csv.split("\r\n");
        assertThat(lines[0]).startsWith("id,date,completion_date,location");
        assertThat(lines[1]).contains("TK-CSV").contains("\"Asha, Jr.\"").contains("12.50");
    }

    private long createToken(
            String token,
            String date,
            String location,
            String status,
            String agent,
            String executive,
            String charges,
            String paymentReceived,
            String chargesToExecutive
    ) throws Exception {
        String body = objectMapper.createObjectNode()
                .put("token", token)
                .put("date", date)
                .put("location", location)
                .put("subLocation", location + " North")
                .put("clientName", "Client " + token)
                .put("status", status)
                .put("agentName", agent)
                .put("executiveName", executive)
                .put("charges", new BigDecimal(charges))
                .put("paymentReceived", new BigDecimal(paymentReceived))
                .put("chargesToExecutive", new BigDecimal(chargesToExecutive))
                .toString();

        MvcResult result = mockMvc.perform(post("/api/tokens")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andReturn();
        JsonNode created = objectMapper.readTree(result.getResponse().getContentAsString());
        return created.path("id").asLong();
    }

    private void setCompletion(long id, String completionDate) {
        TokenRecord record = tokenRecordRepository.findById(id).orElseThrow();
        record.setCompletionDate(LocalDate.parse(completionDate));
        tokenRecordRepository.saveAndFlush(record);
    }
}
