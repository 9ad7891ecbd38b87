package com.flagship.wallet_ledger.payment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wallet_ledger.wallet.OpenWalletCommand;
import com.flagship.wallet_ledger.wallet.WalletAccount;
import com.flagship.wallet_ledger.wallet.WalletAccountService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP surface for payments: status codes, error bodies and the idempotency header.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class PaymentControllerTest {

    private static final String PIN = "2468";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private WalletAccountService walletAccountService;

    private WalletAccount payer;
    private WalletAccount payee;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        payer = open("payer", 100_000);
        payee = open("payee", 0);
    }

    private WalletAccount open(String prefix, long balance) {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        return walletAccountService.openWallet(OpenWalletCommand.builder()
            .displayName(prefix + " " + suffix)
            .email(prefix + "." + suffix + "@example.com")
            .upiId(prefix + "." + suffix + "@okbank")
            .openingBalance(balance)
            .pin(PIN)
            .build());
    }

    private Map<String, Object> transferBody(Object amount, String pin) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("recipient", payee.getEmail());
        body.put("amount", amount);
        body.put("pin", pin);
        body.put("note", "Rent share");
        return body;
    }

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    @Test
    @DisplayName("Transfer returns 201 with the entry and the new balance")
    void transferCreated() throws Exception {
        printTestHeader("POST /api/payments/transfer");
        Map<String, Object> body = transferBody("250.50", PIN);
        printInput("Body", body);

        MvcResult result = mockMvc.perform(post("/api/payments/transfer")
                .header("X-User-Id", payer.getUserId().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(body)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.transaction.status").value("COMPLETED"))
            .andExpect(jsonPath("$.transaction.direction").value("DEBIT"))
            .andExpect(jsonPath("$.transaction.amount").value(250.5))
            .andExpect(jsonPath("$.new_balance").value(749.5))
            .andReturn();
        printOutput("Response", result.getResponse().getContentAsString());

        mockMvc.perform(get("/api/payments/balance").header("X-User-Id", payee.getUserId().toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.balance").value(250.5))
            .andExpect(jsonPath("$.currency").value("INR"));

        printSuccess("Transfer accepted and balances reported in rupees");
    }

    @Test
    @DisplayName("Missing X-User-Id is a 400")
    void missingUserHeader() throws Exception {
        mockMvc.perform(post("/api/payments/transfer")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(transferBody("10.00", PIN))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("Amounts with more than two decimals or below one paisa are rejected")
    void invalidAmounts() throws Exception {
        mockMvc.perform(post("/api/payments/transfer")
                .header("X-User-Id", payer.getUserId().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(transferBody("10.005", PIN))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        mockMvc.perform(post("/api/payments/transfer")
                .header("X-User-Id", payer.getUserId().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(transferBody("0", PIN))))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Wrong PIN is a 401, overdraft a 422, unknown recipient a 404")
    void errorMapping() throws Exception {
        printTestHeader("Error Status Mapping");

        mockMvc.perform(post("/api/payments/transfer")
                .header("X-User-Id", payer.getUserId().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(transferBody("10.00", "0000"))))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.code").value("AUTHENTICATION_FAILED"))
            .andExpect(jsonPath("$.message").value("Invalid PIN"));

        mockMvc.perform(post("/api/payments/transfer")
                .header("X-User-Id", payer.getUserId().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(transferBody("5000.00", PIN))))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.code").value("INSUFFICIENT_FUNDS"))
            .andExpect(jsonPath("$.message").value("Insufficient balance"))
            .andExpect(jsonPath("$.retryable").value(false));

        Map<String, Object> ghost = transferBody("10.00", PIN);
        ghost.put("recipient", "nobody@example.com");
        mockMvc.perform(post("/api/payments/transfer")
                .header("X-User-Id", payer.getUserId().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(ghost)))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("COUNTERPARTY_NOT_FOUND"));

        printSuccess("Each failure mapped to its status");
    }

    @Test
    @DisplayName("Same Idempotency-Key replays the first response without a second debit")
    void idempotentReplay() throws Exception {
        printTestHeader("Idempotency-Key Replay");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("upi_id", "bakery@upi");
        body.put("recipient_name", "Bakery");
        body.put("amount", "120.00");
        body.put("pin", PIN);
        String key = "key-" + UUID.randomUUID();

        JsonNode first = objectMapper.readTree(mockMvc.perform(post("/api/payments/upi")
                .header("X-User-Id", payer.getUserId().toString())
                .header("Idempotency-Key", key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(body)))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString());
        JsonNode second = objectMapper.readTree(mockMvc.perform(post("/api/payments/upi")
                .header("X-User-Id", payer.getUserId().toString())
                .header("Idempotency-Key", key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(body)))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString());
        printOutput("First", first.at("/transaction/transaction_id").asText());
        printOutput("Second", second.at("/transaction/transaction_id").asText());

        assertEquals(first.at("/transaction/transaction_id").asText(), second.at("/transaction/transaction_id").asText());
        assertEquals(key, second.at("/transaction/external_reference_id").asText());
        assertEquals(880.0, second.at("/new_balance").asDouble());

        printSuccess("Replay answered with the original entry");
    }

    @Test
    @DisplayName("Recharge and add-money go through their own endpoints")
    void rechargeAndAddMoney() throws Exception {
        Map<String, Object> recharge = new LinkedHashMap<>();
        recharge.put("mobile_number", "9876543210");
        recharge.put("operator", "Airtel");
        recharge.put("plan", "299");
        recharge.put("amount", "299.00");
        recharge.put("pin", PIN);

        mockMvc.perform(post("/api/payments/recharge")
                .header("X-User-Id", payer.getUserId().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(recharge)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.transaction.type").value("RECHARGE"))
            .andExpect(jsonPath("$.transaction.metadata.operator").value("Airtel"))
            .andExpect(jsonPath("$.new_balance").value(701.0));

        mockMvc.perform(post("/api/payments/add-money")
                .header("X-User-Id", payee.getUserId().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("amount", "50.00", "card_last4", "1111"))))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.transaction.direction").value("CREDIT"))
            .andExpect(jsonPath("$.transaction.payment_method").value("CARD"))
            .andExpect(jsonPath("$.new_balance").value(50.0));
    }

    private void assertBalanceUnchanged() throws Exception {
        mockMvc.perform(get("/api/payments/balance").header("X-User-Id", payer.getUserId().toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.balance").value(1000.0));
    }

    @Test
    @DisplayName("Text longer than its column is a non-retryable 400 and moves no money")
    void overlongText() throws Exception {
        printTestHeader("Over-long Text Fields");

        Map<String, Object> transfer = transferBody("10.00", PIN);
        transfer.put("note", "n".repeat(501));
        printInput("Note length", 501);
        MvcResult result = mockMvc.perform(post("/api/payments/transfer")
                .header("X-User-Id", payer.getUserId().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(transfer)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.retryable").value(false))
            .andReturn();
        printOutput("Response", result.getResponse().getContentAsString());

        Map<String, Object> upi = new LinkedHashMap<>();
        upi.put("upi_id", "bakery@upi");
        upi.put("recipient_name", "B".repeat(201));
        upi.put("amount", "10.00");
        upi.put("pin", PIN);
        mockMvc.perform(post("/api/payments/upi")
                .header("X-User-Id", payer.getUserId().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(upi)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        Map<String, Object> card = new LinkedHashMap<>();
        card.put("merchant_name", "Cinema");
        card.put("card_last4", "4242");
        card.put("amount", "10.00");
        card.put("pin", PIN);
        card.put("description", "d".repeat(501));
        mockMvc.perform(post("/api/payments/card")
                .header("X-User-Id", payer.getUserId().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(card)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        Map<String, Object> recharge = new LinkedHashMap<>();
        recharge.put("mobile_number", "9".repeat(33));
        recharge.put("operator", "Airtel");
        recharge.put("amount", "10.00");
        recharge.put("pin", PIN);
        mockMvc.perform(post("/api/payments/recharge")
                .header("X-User-Id", payer.getUserId().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(recharge)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        Map<String, Object> bill = new LinkedHashMap<>();
        bill.put("biller_name", "Power Co");
        bill.put("consumer_number", "c".repeat(65));
        bill.put("amount", "10.00");
        bill.put("pin", PIN);
        mockMvc.perform(post("/api/payments/bill")
                .header("X-User-Id", payer.getUserId().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(bill)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        assertBalanceUnchanged();
        printSuccess("Every over-long field rejected before anything was written");
    }

    @Test
    @DisplayName("An Idempotency-Key over 128 characters is a 400; exactly 128 is accepted")
    void idempotencyKeyLength() throws Exception {
        printTestHeader("Idempotency-Key Length");

        mockMvc.perform(post("/api/payments/transfer")
                .header("X-User-Id", payer.getUserId().toString())
                .header("Idempotency-Key", "k".repeat(200))
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(transferBody("10.00", PIN))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.retryable").value(false));
        assertBalanceUnchanged();

        String key = (UUID.randomUUID().toString() + "k".repeat(128)).substring(0, 128);
        mockMvc.perform(post("/api/payments/transfer")
                .header("X-User-Id", payer.getUserId().toString())
                .header("Idempotency-Key", key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(transferBody("10.00", PIN))))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.transaction.external_reference_id").value(key))
            .andExpect(jsonPath("$.new_balance").value(990.0));

        printSuccess("Key length enforced at the boundary");
    }

    @Test
    @DisplayName("Malformed JSON is a 400")
    void malformedBody() throws Exception {
        mockMvc.perform(post("/api/payments/upi")
                .header("X-User-Id", payer.getUserId().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }
}
