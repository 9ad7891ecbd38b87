package com.flagship.wallet_ledger.payment;

import com.flagship.wallet_ledger.exception.ValidationException;
import com.flagship.wallet_ledger.ledger.LedgerTransaction;
import com.flagship.wallet_ledger.ledger.PartyDetails;
import com.flagship.wallet_ledger.ledger.PaymentMethod;
import com.flagship.wallet_ledger.ledger.PaymentMethodDetails;
import com.flagship.wallet_ledger.ledger.dto.TransactionResponse;
import com.flagship.wallet_ledger.payment.dto.AddMoneyRequest;
import com.flagship.wallet_ledger.payment.dto.BalanceResponse;
import com.flagship.wallet_ledger.payment.dto.BillPaymentRequest;
import com.flagship.wallet_ledger.payment.dto.BiometricPaymentRequest;
import com.flagship.wallet_ledger.payment.dto.CardPaymentRequest;
import com.flagship.wallet_ledger.payment.dto.PaymentResponse;
import com.flagship.wallet_ledger.payment.dto.RechargeRequest;
import com.flagship.wallet_ledger.payment.dto.TransferRequest;
import com.flagship.wallet_ledger.payment.dto.UpiPaymentRequest;
import com.flagship.wallet_ledger.verification.VerificationMethod;
import com.flagship.wallet_ledger.wallet.BalanceAccessor;
import com.flagship.wallet_ledger.wallet.Money;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * REST entry points for money movement.
 *
 * The caller arrives already authenticated: {@code X-User-Id} carries the
 * resolved wallet owner. An optional {@code Idempotency-Key} header makes a
 * request safe to retry; a replay answers with the entry recorded the first
 * time and moves no money.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    static final String USER_ID_HEADER = "X-User-Id";
    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    static final int IDEMPOTENCY_KEY_MAX_LENGTH = 128;

    private final PaymentProcessor paymentProcessor;
    private final BalanceAccessor balanceAccessor;

    @PostMapping("/transfer")
    public ResponseEntity<PaymentResponse> transfer(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody TransferRequest request) {
        log.info("Transfer requested: userId={}, amount={}, idempotencyKey={}", userId, request.getAmount(), idempotencyKey);
        LedgerTransaction entry = paymentProcessor.processTransfer(userId, TransferCommand.builder()
            .recipientIdentifier(request.getRecipient())
            .amount(Money.toMinor(request.getAmount()))
            .authProof(authProof(request.getPin(), request.getBiometricType(), request.getBiometricData()))
            .note(request.getNote())
            .externalReferenceId(checkedIdempotencyKey(idempotencyKey))
            .build());
        return respond(userId, entry);
    }

    @PostMapping("/upi")
    public ResponseEntity<PaymentResponse> payUpi(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody UpiPaymentRequest request) {
        PaymentCommand command = PaymentCommand.builder()
            .paymentType(PaymentType.UPI)
            .amount(Money.toMinor(request.getAmount()))
            .counterpart(PartyDetails.builder()
                .name(request.getRecipientName() != null ? request.getRecipientName() : request.getUpiId())
                .upiId(request.getUpiId())
                .build())
            .authProof(authProof(request.getPin(), request.getBiometricType(), request.getBiometricData()))
            .paymentMethodDetails(PaymentMethodDetails.builder()
                .upiId(request.getUpiId())
                .upiApp(request.getUpiApp())
                .build())
            .remarks(request.getNote())
            .externalReferenceId(checkedIdempotencyKey(idempotencyKey))
            .build();
        return respond(userId, paymentProcessor.processPayment(userId, command));
    }

    @PostMapping("/biometric")
    public ResponseEntity<PaymentResponse> payBiometric(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody BiometricPaymentRequest request) {
        PaymentCommand command = PaymentCommand.builder()
            .paymentType(PaymentType.BIOMETRIC)
            .amount(Money.toMinor(request.getAmount()))
            .counterpart(PartyDetails.builder()
                .name(request.getRecipientName())
                .upiId(request.getRecipientUpiId())
                .build())
            .authProof(new AuthProof(request.getBiometricType(), request.getBiometricData()))
            .remarks(request.getNote())
            .externalReferenceId(checkedIdempotencyKey(idempotencyKey))
            .build();
        return respond(userId, paymentProcessor.processPayment(userId, command));
    }

    @PostMapping("/recharge")
    public ResponseEntity<PaymentResponse> recharge(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody RechargeRequest request) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("rechargeType", request.getRechargeType() != null ? request.getRechargeType() : "mobile");
        metadata.put("operator", request.getOperator());
        if (request.getPlan() != null) {
            metadata.put("plan", request.getPlan());
        }
        PaymentCommand command = PaymentCommand.builder()
            .paymentType(PaymentType.RECHARGE)
            .amount(Money.toMinor(request.getAmount()))
            .counterpart(PartyDetails.builder()
                .name(request.getOperator())
                .phone(request.getMobileNumber())
                .build())
            .authProof(authProof(request.getPin(), request.getBiometricType(), request.getBiometricData()))
            .description(request.getOperator() + " recharge for " + request.getMobileNumber())
            .metadata(metadata)
            .externalReferenceId(checkedIdempotencyKey(idempotencyKey))
            .build();
        return respond(userId, paymentProcessor.processPayment(userId, command));
    }

    @PostMapping("/bill")
    public ResponseEntity<PaymentResponse> payBill(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody BillPaymentRequest request) {
        PaymentCommand command = PaymentCommand.builder()
            .paymentType(PaymentType.BILL)
            .amount(Money.toMinor(request.getAmount()))
            .counterpart(PartyDetails.builder()
                .name(request.getBillerName())
                .accountNumber(request.getConsumerNumber())
                .build())
            .authProof(authProof(request.getPin(), request.getBiometricType(), request.getBiometricData()))
            .category(request.getBillCategory())
            .externalReferenceId(checkedIdempotencyKey(idempotencyKey))
            .build();
        return respond(userId, paymentProcessor.processPayment(userId, command));
    }

    @PostMapping("/card")
    public ResponseEntity<PaymentResponse> payCard(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody CardPaymentRequest request) {
        PaymentCommand command = PaymentCommand.builder()
            .paymentType(PaymentType.CARD)
            .amount(Money.toMinor(request.getAmount()))
            .counterpart(PartyDetails.builder().name(request.getMerchantName()).build())
            .authProof(authProof(request.getPin(), request.getBiometricType(), request.getBiometricData()))
            .paymentMethodDetails(PaymentMethodDetails.builder()
                .cardLast4(request.getCardLast4())
                .cardBrand(request.getCardBrand())
                .build())
            .description(request.getDescription())
            .externalReferenceId(checkedIdempotencyKey(idempotencyKey))
            .build();
        return respond(userId, paymentProcessor.processPayment(userId, command));
    }

    @PostMapping("/add-money")
    public ResponseEntity<PaymentResponse> addMoney(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody AddMoneyRequest request) {
        PaymentMethod method = request.getPaymentMethod() != null ? request.getPaymentMethod() : PaymentMethod.CARD;
        PaymentCommand command = PaymentCommand.builder()
            .paymentType(PaymentType.ADD_MONEY)
            .amount(Money.toMinor(request.getAmount()))
            .counterpart(PartyDetails.builder()
                .name(request.getBankName() != null ? request.getBankName() : method.name())
                .upiId(request.getUpiId())
                .build())
            .paymentMethod(method)
            .paymentMethodDetails(PaymentMethodDetails.builder()
                .cardLast4(request.getCardLast4())
                .cardBrand(request.getCardBrand())
                .bankName(request.getBankName())
                .upiId(request.getUpiId())
                .build())
            .externalReferenceId(checkedIdempotencyKey(idempotencyKey))
            .build();
        return respond(userId, paymentProcessor.processPayment(userId, command));
    }

    @GetMapping("/balance")
    public ResponseEntity<BalanceResponse> balance(@RequestHeader(USER_ID_HEADER) UUID userId) {
        return ResponseEntity.ok(new BalanceResponse(userId, Money.toMajor(balanceAccessor.getBalance(userId)), "INR"));
    }

    private ResponseEntity<PaymentResponse> respond(UUID userId, LedgerTransaction entry) {
        PaymentResponse body = new PaymentResponse(TransactionResponse.from(entry),
                Money.toMajor(balanceAccessor.getBalance(userId)));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    private static String checkedIdempotencyKey(String idempotencyKey) {
        if (idempotencyKey != null && idempotencyKey.length() > IDEMPOTENCY_KEY_MAX_LENGTH) {
            throw new ValidationException(IDEMPOTENCY_KEY_HEADER + " must be at most "
                    + IDEMPOTENCY_KEY_MAX_LENGTH + " characters");
        }
        return idempotencyKey;
    }

    private static AuthProof authProof(String pin, VerificationMethod biometricType, String biometricData) {
        if (biometricType != null && biometricType != VerificationMethod.PIN) {
            return new AuthProof(biometricType, biometricData);
        }
        return AuthProof.pin(pin);
    }
}
