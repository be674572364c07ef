package com.siteledger.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.siteledger.domain.TransactionType;
import com.siteledger.dto.OpenFinancialAccountRequest;
import com.siteledger.dto.OpenInventoryAccountRequest;
import com.siteledger.dto.RecordTransactionRequest;
import com.siteledger.service.LedgerInconsistencyEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultMatcher;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end ledger behaviour through the REST API.
 *
 * Full application context with real transaction management on H2
 * (application-test.yml). Every test opens its own accounts, so tests do not
 * depend on each other or on execution order.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@RecordApplicationEvents
class LedgerEngineIntegrationTest {

    @Autowired MockMvc      mockMvc;
    @Autowired ObjectMapper objectMapper;
    @Autowired JdbcTemplate jdbcTemplate;
    @Autowired ApplicationEvents events;

    // ── helpers ───────────────────────────────────────────────────────────────

    private static String code(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private JsonNode read(String json) throws Exception {
        return objectMapper.readTree(json);
    }

    private long openSupplier(Integer terms) throws Exception {
        String json = mockMvc.perform(post("/accounts/financial")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new OpenFinancialAccountRequest(code("SUP"), "Cement Co", terms))))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return read(json).get("accountId").asLong();
    }

    private long openMaterial(String min, String max, String reorder) throws Exception {
        var request = new OpenInventoryAccountRequest(code("MAT"), "Cement bags", "Site A",
                new BigDecimal(min), max != null ? new BigDecimal(max) : null,
                reorder != null ? new BigDecimal(reorder) : null);
        String json = mockMvc.perform(post("/accounts/inventory")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return read(json).get("accountId").asLong();
    }

    private JsonNode record(long accountId, RecordTransactionRequest request, ResultMatcher expected)
            throws Exception {
        String json = mockMvc.perform(post("/accounts/" + accountId + "/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(expected)
                .andReturn().getResponse().getContentAsString();
        return read(json);
    }

    private JsonNode record(long accountId, TransactionType type, String amount) throws Exception {
        return record(accountId, new RecordTransactionRequest(type, new BigDecimal(amount), null),
                status().isCreated());
    }

    private JsonNode getJson(String url) throws Exception {
        return read(mockMvc.perform(get(url))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString());
    }

    private JsonNode summary(long accountId) throws Exception {
        return getJson("/accounts/" + accountId + "/summary");
    }

    private static List<Long> accountIds(JsonNode alerts) {
        List<Long> ids = new ArrayList<>();
        for (JsonNode alert : alerts) {
            ids.add(alert.get("account").get("accountId").asLong());
        }
        return ids;
    }

    private static BigDecimal decimal(JsonNode node) {
        return new BigDecimal(node.asText());
    }

    // ══════════════════════════════════════════════════════════════════════════
    //  SUPPLIER LEDGER
    // ══════════════════════════════════════════════════════════════════════════
    @Nested @DisplayName("supplier ledger")
    class SupplierTests {

        @Test @DisplayName("new account → NO_ACTIVITY, balance 0")
        void untouched() throws Exception {
            long id = openSupplier(30);

            JsonNode summary = summary(id);

            assertThat(summary.get("status").asText()).isEqualTo("NO_ACTIVITY");
            assertThat(decimal(summary.get("currentBalance"))).isEqualByComparingTo("0");
            assertThat(summary.get("entryCount").asLong()).isZero();
        }

        @Test @DisplayName("purchase 1000 → PENDING; pay 600 → PARTIAL 400; pay 400 → PAID")
        void purchaseAndPayments() throws Exception {
            long id = openSupplier(30);

            JsonNode purchase = record(id, TransactionType.PURCHASE, "1000");
            assertThat(purchase.get("entryNumber").asLong()).isEqualTo(1);
            assertThat(decimal(purchase.get("delta"))).isEqualByComparingTo("1000");
            assertThat(purchase.get("dueDate").isNull()).isFalse();
            assertThat(summary(id).get("status").asText()).isEqualTo("PENDING");

            JsonNode payment = record(id, TransactionType.PAYMENT, "600");
            assertThat(decimal(payment.get("delta"))).isEqualByComparingTo("-600");
            assertThat(decimal(payment.get("balanceAfter"))).isEqualByComparingTo("400");
            JsonNode partial = summary(id);
            assertThat(partial.get("status").asText()).isEqualTo("PARTIAL");
            assertThat(decimal(partial.get("currentBalance"))).isEqualByComparingTo("400");

            record(id, TransactionType.PAYMENT, "400");
            JsonNode paid = summary(id);
            assertThat(paid.get("status").asText()).isEqualTo("PAID");
            assertThat(decimal(paid.get("currentBalance"))).isEqualByComparingTo("0");
            assertThat(decimal(paid.get("totalDebits"))).isEqualByComparingTo("1000");
            assertThat(decimal(paid.get("totalCredits"))).isEqualByComparingTo("1000");
            assertThat(paid.get("entryCount").asLong()).isEqualTo(3);
        }

        @Test @DisplayName("negative payment → 400, nothing written")
        void negativePayment() throws Exception {
            long id = openSupplier(null);

            JsonNode error = record(id, new RecordTransactionRequest(TransactionType.PAYMENT,
                    new BigDecimal("-600"), null), status().isBadRequest());

            assertThat(error.get("error").asText()).isEqualTo("VALIDATION_ERROR");
            assertThat(summary(id).get("entryCount").asLong()).isZero();
        }

        @Test @DisplayName("amount wider than the ledger columns → 400 on the first attempt, nothing written")
        void oversizedAmount() throws Exception {
            long id = openSupplier(null);

            JsonNode error = record(id, new RecordTransactionRequest(TransactionType.PURCHASE,
                    new BigDecimal("1E+16"), null), status().isBadRequest());

            assertThat(error.get("error").asText()).isEqualTo("VALIDATION_ERROR");
            assertThat(error.get("message").asText()).contains("integer digits");
            assertThat(summary(id).get("entryCount").asLong()).isZero();
            assertThat(getJson("/accounts/" + id).get("halted").asBoolean()).isFalse();
        }

        @Test @DisplayName("purchase pushing the balance past the columns → 400, balance unchanged")
        void balanceOverflow() throws Exception {
            long id = openSupplier(null);
            record(id, TransactionType.PURCHASE, "900000000000000");

            record(id, new RecordTransactionRequest(TransactionType.PURCHASE,
                    new BigDecimal("200000000000000"), null), status().isBadRequest());

            assertThat(decimal(summary(id).get("currentBalance"))).isEqualByComparingTo("900000000000000");
        }

        @Test @DisplayName("inventory type on supplier → 400")
        void wrongLedger() throws Exception {
            long id = openSupplier(null);

            record(id, new RecordTransactionRequest(TransactionType.RESTOCK, BigDecimal.TEN, null),
                    status().isBadRequest());
        }

        @Test @DisplayName("unpaid purchase past its due date → OVERDUE and listed in alerts")
        void overdue() throws Exception {
            long id = openSupplier(null);
            LocalDate today = LocalDate.now(ZoneOffset.UTC);
            var purchase = new RecordTransactionRequest(TransactionType.PURCHASE, new BigDecimal("1000"),
                    Instant.now().minus(60, ChronoUnit.DAYS));
            purchase.setDueDate(today.minusDays(30));
            purchase.setReference("INV-OLD");
            record(id, purchase, status().isCreated());
            record(id, TransactionType.PAYMENT, "250");

            JsonNode summary = summary(id);
            assertThat(summary.get("status").asText()).isEqualTo("OVERDUE");
            assertThat(decimal(summary.get("overdueAmount"))).isEqualByComparingTo("750");
            assertThat(summary.get("oldestOverdueDueDate").asText()).isEqualTo(today.minusDays(30).toString());

            JsonNode alerts = getJson("/ledger/alerts?kind=FINANCIAL");
            assertThat(accountIds(alerts)).contains(id);
            JsonNode overdueRows = null;
            for (JsonNode alert : alerts) {
                if (alert.get("account").get("accountId").asLong() == id) {
                    overdueRows = alert.get("overdueEntries");
                }
            }
            assertThat(overdueRows).isNotNull();
            assertThat(overdueRows.size()).isEqualTo(1);
            assertThat(overdueRows.get(0).get("reference").asText()).isEqualTo("INV-OLD");
            assertThat(decimal(overdueRows.get(0).get("outstanding"))).isEqualByComparingTo("750");
            assertThat(overdueRows.get(0).get("daysOverdue").asLong()).isEqualTo(30);

            JsonNode before = getJson("/ledger/alerts?kind=FINANCIAL&asOf=" + today.minusDays(40));
            assertThat(accountIds(before)).doesNotContain(id);
        }

        @Test @DisplayName("history statuses follow FIFO settlement")
        void historyStatuses() throws Exception {
            long id = openSupplier(30);
            record(id, TransactionType.PURCHASE, "500");
            record(id, TransactionType.PURCHASE, "500");
            record(id, TransactionType.PAYMENT, "600");

            JsonNode entries = getJson("/accounts/" + id + "/history?order=SEQUENCE").get("entries");

            assertThat(entries.get(0).get("status").asText()).isEqualTo("PAID");
            assertThat(entries.get(1).get("status").asText()).isEqualTo("PARTIAL");
            assertThat(entries.get(2).get("status").asText()).isEqualTo("PARTIAL");
        }
    }

    // ══════════════════════════════════════════════════════════════════════════
    //  INVENTORY LEDGER
    // ══════════════════════════════════════════════════════════════════════════
    @Nested @DisplayName("inventory ledger")
    class InventoryTests {

        @Test @DisplayName("50 in, issue 40 → 10 LOW with reorder; restock 100 → 110 NORMAL")
        void materialScenario() throws Exception {
            long id = openMaterial("20", "200", "25");
            record(id, TransactionType.RESTOCK, "50");

            JsonNode issue = record(id, TransactionType.ISSUE, "40");
            assertThat(decimal(issue.get("balanceAfter"))).isEqualByComparingTo("10");
            JsonNode low = summary(id);
            assertThat(low.get("status").asText()).isEqualTo("LOW");
            assertThat(low.get("reorderRequired").asBoolean()).isTrue();

            JsonNode alerts = getJson("/ledger/alerts?kind=INVENTORY");
            JsonNode row = null;
            for (JsonNode alert : alerts) {
                if (alert.get("account").get("accountId").asLong() == id) {
                    row = alert;
                }
            }
            assertThat(row).isNotNull();
            assertThat(row.get("reasons").toString()).contains("LOW_STOCK").contains("REORDER");

            record(id, TransactionType.RESTOCK, "100");
            JsonNode restocked = summary(id);
            assertThat(decimal(restocked.get("currentBalance"))).isEqualByComparingTo("110");
            assertThat(restocked.get("status").asText()).isEqualTo("NORMAL");
            assertThat(restocked.get("reorderRequired").asBoolean()).isFalse();
        }

        @Test @DisplayName("issue 60 of 50 → 409, no entry, balance unchanged")
        void overIssue() throws Exception {
            long id = openMaterial("20", null, null);
            record(id, TransactionType.RESTOCK, "50");

            JsonNode error = record(id, new RecordTransactionRequest(TransactionType.ISSUE,
                    new BigDecimal("60"), null), status().isConflict());

            assertThat(error.get("error").asText()).isEqualTo("INSUFFICIENT_STOCK");
            JsonNode summary = summary(id);
            assertThat(decimal(summary.get("currentBalance"))).isEqualByComparingTo("50");
            assertThat(summary.get("entryCount").asLong()).isEqualTo(1);
        }

        @Test @DisplayName("backorder override → negative stock, entry flagged")
        void backorder() throws Exception {
            long id = openMaterial("20", null, null);
            record(id, TransactionType.RESTOCK, "50");
            var issue = new RecordTransactionRequest(TransactionType.ISSUE, new BigDecimal("60"), null);
            issue.setAllowBackorder(true);

            JsonNode entry = record(id, issue, status().isCreated());

            assertThat(entry.get("backorder").asBoolean()).isTrue();
            assertThat(decimal(entry.get("balanceAfter"))).isEqualByComparingTo("-10");
        }

        @Test @DisplayName("threshold change re-evaluates status without a ledger entry")
        void thresholdChange() throws Exception {
            long id = openMaterial("20", null, null);
            record(id, TransactionType.RESTOCK, "30");
            assertThat(summary(id).get("status").asText()).isEqualTo("NORMAL");

            mockMvc.perform(put("/accounts/" + id + "/thresholds")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"minimumStockLevel\":40}"))
                    .andExpect(status().isOk());

            JsonNode summary = summary(id);
            assertThat(summary.get("status").asText()).isEqualTo("LOW");
            assertThat(summary.get("entryCount").asLong()).isEqualTo(1);
        }

        @Test @DisplayName("backdated entry → next entry number, sorted first chronologically")
        void backdated() throws Exception {
            long id = openMaterial("0", null, null);
            record(id, TransactionType.RESTOCK, "50");
            var late = new RecordTransactionRequest(TransactionType.RETURN, new BigDecimal("5"),
                    Instant.now().minus(10, ChronoUnit.DAYS));

            JsonNode entry = record(id, late, status().isCreated());
            assertThat(entry.get("entryNumber").asLong()).isEqualTo(2);
            assertThat(decimal(entry.get("balanceAfter"))).isEqualByComparingTo("55");

            JsonNode chronological = getJson("/accounts/" + id + "/history").get("entries");
            assertThat(chronological.get(0).get("entryNumber").asLong()).isEqualTo(2);
            assertThat(chronological.get(1).get("entryNumber").asLong()).isEqualTo(1);
        }

        @Test @DisplayName("bulk restock → valid lines recorded, unknown and supplier lines reported")
        void bulkRestock() throws Exception {
            long cement = openMaterial("20", null, null);
            long sand = openMaterial("5", null, null);
            long supplier = openSupplier(null);
            record(cement, TransactionType.RESTOCK, "10");
            String body = "{\"reference\":\"GRN-88\",\"restocks\":["
                    + "{\"accountId\":" + cement + ",\"quantity\":40},"
                    + "{\"accountId\":" + sand + ",\"quantity\":12.5},"
                    + "{\"accountId\":" + Long.MAX_VALUE + ",\"quantity\":3},"
                    + "{\"accountId\":" + supplier + ",\"quantity\":3}]}";

            JsonNode result = read(mockMvc.perform(post("/restocks/bulk")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isCreated())
                    .andReturn().getResponse().getContentAsString());

            assertThat(result.get("recordedCount").asInt()).isEqualTo(2);
            assertThat(result.get("failedCount").asInt()).isEqualTo(2);
            JsonNode failures = result.get("failures");
            assertThat(failures.get(0).get("line").asInt()).isEqualTo(2);
            assertThat(failures.get(0).get("error").asText()).isEqualTo("NOT_FOUND");
            assertThat(failures.get(1).get("line").asInt()).isEqualTo(3);
            assertThat(failures.get(1).get("error").asText()).isEqualTo("VALIDATION_ERROR");
            assertThat(result.get("recorded").get(0).get("reference").asText()).isEqualTo("GRN-88");

            assertThat(decimal(summary(cement).get("currentBalance"))).isEqualByComparingTo("50");
            assertThat(summary(cement).get("entryCount").asLong()).isEqualTo(2);
            assertThat(decimal(summary(sand).get("currentBalance"))).isEqualByComparingTo("12.5");
            assertThat(summary(supplier).get("entryCount").asLong()).isEqualTo(0);
        }

        @Test @DisplayName("bulk restock where every line is refused → 422, nothing written")
        void bulkRestockAllRefused() throws Exception {
            long supplier = openSupplier(null);
            String body = "{\"restocks\":[{\"accountId\":" + supplier + ",\"quantity\":3}]}";

            mockMvc.perform(post("/restocks/bulk")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.failures[0].error").value("VALIDATION_ERROR"));

            assertThat(summary(supplier).get("entryCount").asLong()).isEqualTo(0);
        }
    }

    // ══════════════════════════════════════════════════════════════════════════
    //  QUERIES
    // ══════════════════════════════════════════════════════════════════════════
    @Nested @DisplayName("queries")
    class QueryTests {

        @Test @DisplayName("every prefix of the history replays to its balanceAfter")
        void prefixReplay() throws Exception {
            long id = openMaterial("0", null, null);
            String[][] moves = {{"RESTOCK", "50"}, {"ISSUE", "12.5"}, {"ADJUSTMENT", "-2.25"},
                                {"RETURN", "3"}, {"CONSUMPTION", "8"}, {"RESTOCK", "100"},
                                {"ISSUE", "1"}, {"ADJUSTMENT", "0.75"}, {"ISSUE", "30"}};
            for (String[] move : moves) {
                record(id, TransactionType.valueOf(move[0]), move[1]);
            }

            BigDecimal running = BigDecimal.ZERO;
            int seen = 0;
            for (int page = 1; page <= 2; page++) {
                JsonNode entries = getJson("/accounts/" + id + "/history?order=SEQUENCE&size=5&page=" + page)
                        .get("entries");
                for (JsonNode entry : entries) {
                    running = running.add(decimal(entry.get("delta")));
                    assertThat(decimal(entry.get("balanceAfter"))).isEqualByComparingTo(running);
                    seen++;
                }
            }
            assertThat(seen).isEqualTo(moves.length);
            assertThat(decimal(summary(id).get("currentBalance"))).isEqualByComparingTo(running);
        }

        @Test @DisplayName("repeated summary without writes → identical response")
        void idempotentSummary() throws Exception {
            long id = openSupplier(15);
            record(id, TransactionType.PURCHASE, "99.95");

            String first = mockMvc.perform(get("/accounts/" + id + "/summary"))
                    .andReturn().getResponse().getContentAsString();
            String second = mockMvc.perform(get("/accounts/" + id + "/summary"))
                    .andReturn().getResponse().getContentAsString();

            assertThat(second).isEqualTo(first);
        }

        @Test @DisplayName("history filtered by type and paged")
        void filteredHistory() throws Exception {
            long id = openSupplier(null);
            record(id, TransactionType.PURCHASE, "100");
            record(id, TransactionType.PAYMENT, "10");
            record(id, TransactionType.PAYMENT, "20");

            JsonNode page = getJson("/accounts/" + id + "/history?type=PAYMENT&size=1&page=2");

            assertThat(page.get("pagination").get("totalItems").asLong()).isEqualTo(2);
            assertThat(page.get("pagination").get("totalPages").asInt()).isEqualTo(2);
            assertThat(decimal(page.get("entries").get(0).get("delta"))).isEqualByComparingTo("-20");
        }

        @Test @DisplayName("history filtered by transaction date range and text")
        void dateRangeAndSearch() throws Exception {
            long id = openSupplier(null);
            var first = new RecordTransactionRequest(TransactionType.PURCHASE, new BigDecimal("1000"),
                    Instant.parse("2026-01-05T10:00:00Z"));
            first.setReference("INV-100");
            first.setDescription("Cement delivery");
            record(id, first, status().isCreated());
            var cheque = new RecordTransactionRequest(TransactionType.PAYMENT, new BigDecimal("500"),
                    Instant.parse("2026-02-10T23:30:00Z"));
            cheque.setReference("CHQ-55");
            cheque.setDescription("Cheque for 50% of inv-100");
            record(id, cheque, status().isCreated());
            var sand = new RecordTransactionRequest(TransactionType.PURCHASE, new BigDecimal("300"),
                    Instant.parse("2026-03-20T08:00:00Z"));
            sand.setReference("INV-101");
            sand.setDescription("Sand");
            record(id, sand, status().isCreated());

            String history = "/accounts/" + id + "/history?order=SEQUENCE";
            JsonNode range = getJson(history + "&from=2026-02-01&to=2026-03-31").get("entries");
            assertThat(range.size()).isEqualTo(2);
            assertThat(range.get(0).get("reference").asText()).isEqualTo("CHQ-55");

            JsonNode upToCheque = getJson(history + "&to=2026-02-10").get("entries");
            assertThat(upToCheque.size()).isEqualTo(2);
            assertThat(upToCheque.get(1).get("entryNumber").asLong()).isEqualTo(2);

            JsonNode byText = getJson(history + "&search=INV-100").get("entries");
            assertThat(byText.size()).isEqualTo(2);
            assertThat(byText.get(1).get("status").asText()).isEqualTo("PARTIAL");

            JsonNode literalPercent = read(mockMvc.perform(get("/accounts/" + id + "/history").param("search", "50%"))
                    .andExpect(status().isOk())
                    .andReturn().getResponse().getContentAsString()).get("entries");
            assertThat(literalPercent.size()).isEqualTo(1);
            assertThat(literalPercent.get(0).get("reference").asText()).isEqualTo("CHQ-55");

            JsonNode combined = getJson(history + "&search=sand&from=2026-03-01&type=PURCHASE");
            assertThat(combined.get("pagination").get("totalItems").asLong()).isEqualTo(1);
        }

        @Test @DisplayName("page size over 100 → 400")
        void pageTooLarge() throws Exception {
            long id = openSupplier(null);

            mockMvc.perform(get("/accounts/" + id + "/history?size=101"))
                    .andExpect(status().isBadRequest());
        }

        @Test @DisplayName("unknown account → 404")
        void unknownAccount() throws Exception {
            mockMvc.perform(get("/accounts/987654/summary"))
                    .andExpect(status().isNotFound());
        }
    }

    // ══════════════════════════════════════════════════════════════════════════
    //  CONSISTENCY
    // ══════════════════════════════════════════════════════════════════════════
    @Nested @DisplayName("consistency")
    class ConsistencyTests {

        @Test @DisplayName("reconcile on healthy account → consistent, not halted")
        void healthy() throws Exception {
            long id = openMaterial("0", null, null);
            record(id, TransactionType.RESTOCK, "50");
            record(id, TransactionType.ISSUE, "10");

            JsonNode report = read(mockMvc.perform(post("/accounts/" + id + "/reconcile"))
                    .andExpect(status().isOk())
                    .andReturn().getResponse().getContentAsString());

            assertThat(report.get("consistent").asBoolean()).isTrue();
            assertThat(report.get("halted").asBoolean()).isFalse();
            assertThat(decimal(report.get("recomputedBalance"))).isEqualByComparingTo("40");
        }

        @Test @DisplayName("tampered entry → reconcile halts account, writes refused, resume refused")
        void tamperedEntry() throws Exception {
            long id = openMaterial("0", null, null);
            record(id, TransactionType.RESTOCK, "50");
            record(id, TransactionType.ISSUE, "10");
            jdbcTemplate.update(
                    "update ledger_entries set balance_after = 45 where account_id = ? and entry_number = 2", id);

            JsonNode report = read(mockMvc.perform(post("/accounts/" + id + "/reconcile"))
                    .andExpect(status().isOk())
                    .andReturn().getResponse().getContentAsString());

            assertThat(report.get("consistent").asBoolean()).isFalse();
            assertThat(report.get("halted").asBoolean()).isTrue();
            assertThat(report.get("divergences").size()).isGreaterThan(0);
            assertThat(events.stream(LedgerInconsistencyEvent.class)
                    .filter(e -> e.getAccountId() == id)).hasSize(1);

            JsonNode refused = record(id, new RecordTransactionRequest(TransactionType.RESTOCK, BigDecimal.ONE, null),
                    status().isConflict());
            assertThat(refused.get("error").asText()).isEqualTo("ACCOUNT_HALTED");

            mockMvc.perform(post("/accounts/" + id + "/resume")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"operator\":\"ops\"}"))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.error").value("CONSISTENCY_VIOLATION"));

            mockMvc.perform(get("/actuator/health/ledgerHealth"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.status").value("DOWN"));
        }

        @Test @DisplayName("drifted cache → append halts account; resume reseeds from entries")
        void driftedCache() throws Exception {
            long id = openSupplier(null);
            record(id, TransactionType.PURCHASE, "1000");
            jdbcTemplate.update("update ledger_accounts set cached_balance = 999 where id = ?", id);

            JsonNode error = record(id, new RecordTransactionRequest(TransactionType.PAYMENT,
                    new BigDecimal("100"), null), status().isInternalServerError());
            assertThat(error.get("error").asText()).isEqualTo("CONSISTENCY_VIOLATION");

            JsonNode halted = getJson("/accounts/" + id);
            assertThat(halted.get("halted").asBoolean()).isTrue();
            assertThat(summary(id).get("entryCount").asLong()).isEqualTo(1);

            JsonNode resumed = read(mockMvc.perform(post("/accounts/" + id + "/resume")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"operator\":\"ops\"}"))
                    .andExpect(status().isOk())
                    .andReturn().getResponse().getContentAsString());
            assertThat(resumed.get("halted").asBoolean()).isFalse();
            assertThat(decimal(resumed.get("balance"))).isEqualByComparingTo("1000");

            JsonNode payment = record(id, TransactionType.PAYMENT, "100");
            assertThat(decimal(payment.get("balanceAfter"))).isEqualByComparingTo("900");
        }
    }
}
