package com.demoBank.atmDemo.session.service;

import com.demoBank.atmDemo.bank.dto.AccountSummary;
import com.demoBank.atmDemo.bank.model.Account;
import com.demoBank.atmDemo.bank.model.AccountType;
import com.demoBank.atmDemo.bank.model.Card;
import com.demoBank.atmDemo.bank.service.AccountService;
import com.demoBank.atmDemo.bank.service.CardResolverService;
import com.demoBank.atmDemo.common.exception.AtmException;
import com.demoBank.atmDemo.common.exception.ErrorKind;
import com.demoBank.atmDemo.common.exception.ResponseCode;
import com.demoBank.atmDemo.config.AtmProperties;
import com.demoBank.atmDemo.intent.model.OperationType;
import com.demoBank.atmDemo.intent.model.ReceiptMode;
import com.demoBank.atmDemo.session.dto.FinalizeRequest;
import com.demoBank.atmDemo.session.dto.FinalizeResponse;
import com.demoBank.atmDemo.session.dto.LoginRequest;
import com.demoBank.atmDemo.session.dto.LoginResponse;
import com.demoBank.atmDemo.session.dto.PinValidationRequest;
import com.demoBank.atmDemo.session.dto.PinValidationResponse;
import com.demoBank.atmDemo.session.dto.PreferencesRequest;
import com.demoBank.atmDemo.session.dto.PreferencesResponse;
import com.demoBank.atmDemo.session.dto.WithdrawalAuthorizeRequest;
import com.demoBank.atmDemo.session.dto.WithdrawalAuthorizeResponse;
import com.demoBank.atmDemo.session.model.AtmSession;
import com.demoBank.atmDemo.session.model.PhaseOutcome;
import com.demoBank.atmDemo.session.model.ProtocolPhase;
import com.demoBank.atmDemo.session.model.SessionPreferences;
import com.demoBank.atmDemo.transaction.dto.TransactionResult;
import com.demoBank.atmDemo.transaction.model.TransactionCommand;
import com.demoBank.atmDemo.transaction.service.TransactionExecutor;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Five-phase ATM protocol: login, preferences, PIN validation with account overview,
 * overview finalization and withdrawal authorization.
 *
 * Every phase call runs under the session lock and is checked in this order:
 * expiry, lockout, identical-payload replay, then sequencing against the phase's predecessor.
 */
@Slf4j
@Service
public class ProtocolPhaseService {

    private static final List<String> ENABLED_TRANSACTIONS = Arrays.stream(OperationType.values())
            .map(Enum::name)
            .toList();
    private static final String RESULT_COMPLETED = "COMPLETED";
    private static final String RESULT_CANCELLED = "CANCELLED";
    private static final int FRACTION_DIGITS = 2;

    private final SessionService sessionService;
    private final CardResolverService cardResolverService;
    private final AccountService accountService;
    private final PinService pinService;
    private final TransactionExecutor transactionExecutor;
    private final SessionArchiveService sessionArchiveService;
    private final Cache<LoginRequest, LoginResponse> loginReplayCache;

    public ProtocolPhaseService(SessionService sessionService,
                                CardResolverService cardResolverService,
                                AccountService accountService,
                                PinService pinService,
                                TransactionExecutor transactionExecutor,
                                SessionArchiveService sessionArchiveService,
                                AtmProperties properties) {
        this.sessionService = sessionService;
        this.cardResolverService = cardResolverService;
        this.accountService = accountService;
        this.pinService = pinService;
        this.transactionExecutor = transactionExecutor;
        this.sessionArchiveService = sessionArchiveService;
        this.loginReplayCache = Caffeine.newBuilder()
                .expireAfterWrite(properties.getSession().getReplayWindow())
                .maximumSize(properties.getSession().getMaxSessions())
                .build();
    }

    /**
     * Phase 1. An identical request inside the replay window gets the original response and no new session.
     *
     * @throws AtmException AUTH_ERROR for unusable cards
     */
    public LoginResponse login(LoginRequest request) {
        LoginResponse replayed = loginReplayCache.getIfPresent(request);
        if (replayed != null) {
            log.info("Login replayed - clientId: {}, clientRequestNumber: {}", request.getClientId(), request.getClientRequestNumber());
            return replayed;
        }
        return loginReplayCache.get(request, this::doLogin);
    }

    private LoginResponse doLogin(LoginRequest request) {
        CardResolverService.ResolvedCard resolved =
                cardResolverService.resolve(request.getConsumerIdentificationData().getTrack2());
        Card card = resolved.card();
        AtmSession session = sessionService.create(card, resolved.customer());

        log.info("Login completed - clientId: {}, sessionId: {}, card: {}",
                request.getClientId(), session.getSessionId(), card.getMaskedPan());

        BigDecimal fastCash = card.getFastCashAmount();
        return LoginResponse.builder()
                .responseCode(ResponseCode.APPROVED.getCode())
                .sessionToken(session.getToken())
                .enabledTransactions(ENABLED_TRANSACTIONS)
                .consumerGroup(card.getCardType())
                .extendedTransactionResponseCode(ResponseCode.APPROVED.getCode())
                .cardDataElementEntitlements(List.of("TRACK2", "EMV"))
                .cardProductProperties(LoginResponse.CardProductProperties.builder()
                        .minPinLength(card.getMinPinLength())
                        .maxPinLength(card.getMaxPinLength())
                        .fastSupported(fastCash != null && fastCash.signum() > 0)
                        .fastCashAmount(fastCash)
                        .build())
                .transactionsSupported(ENABLED_TRANSACTIONS)
                .build();
    }

    /**
     * Phase 2. Pure state capture.
     */
    public PreferencesResponse preferences(String token, PreferencesRequest request) {
        return sessionService.execute(token, session ->
                runPhase(session, ProtocolPhase.PREFERENCES_SET, request, PreferencesResponse.class, () -> {
                    PreferencesRequest.Preferences input = request.getPreferences();
                    ReceiptMode receiptMode = parseReceiptMode(input.getReceiptPreference());
                    String email = input.getEmailId() != null && !input.getEmailId().isBlank()
                            ? input.getEmailId().trim().toLowerCase(Locale.ROOT)
                            : null;
                    if (receiptMode == ReceiptMode.EMAIL && email == null) {
                        throw AtmException.validation("EmailID is required for email receipts");
                    }
                    String language = normalizeLanguage(input.getLanguage());

                    session.setPreferences(SessionPreferences.builder()
                            .language(language)
                            .email(email)
                            .receiptMode(receiptMode)
                            .fastCash(input.isFastCashPreference())
                            .build());

                    Account fastCashSource = accountService.listAccounts(session.getCustomerId()).stream()
                            .filter(summary -> summary.getType() == AccountType.CHECKING)
                            .findFirst()
                            .map(summary -> accountService.getOwnedAccount(session.getCustomerId(), summary.getAccountId()))
                            .orElse(null);

                    return PreferencesResponse.builder()
                            .responseCode(ResponseCode.APPROVED.getCode())
                            .actionCode(ResponseCode.APPROVED.getCode())
                            .messageSequenceNumber(request.getClientRequestNumber())
                            .customerId(session.getCustomerId())
                            .sessionLanguageCode(language)
                            .emailAddress(email)
                            .receiptPreferenceCode(receiptMode.name())
                            .fastCashEnabled(input.isFastCashPreference())
                            .fastCashTransactionAmount(input.isFastCashPreference() ? fastCashAmount(session) : null)
                            .fastCashSourceAccountNumber(fastCashSource != null ? fastCashSource.getMaskedNumber() : null)
                            .fastCashSourceProductTypeCode(fastCashSource != null ? fastCashSource.getType().name() : null)
                            .build();
                }));
    }

    /**
     * Phase 3. Returns the customer's accounts with live balances on success.
     *
     * @throws AtmException PIN_ERROR, PIN_ERROR(lockout) or SEQUENCE_ERROR
     */
    public PinValidationResponse validatePin(String token, PinValidationRequest request) {
        return sessionService.execute(token, session ->
                runPhase(session, ProtocolPhase.PIN_VALIDATED, request, PinValidationResponse.class, () -> {
                    pinService.verify(session, request.getEncryptedPinData());

                    List<AccountSummary> accounts = accountService.listAccounts(session.getCustomerId());
                    session.setOverview(new ArrayList<>(accounts));

                    return PinValidationResponse.builder()
                            .responseCode(ResponseCode.APPROVED.getCode())
                            .actionCode(ResponseCode.APPROVED.getCode())
                            .messageSequenceNumber(request.getClientRequestNumber())
                            .primaryAccountNumber(session.getMaskedPan())
                            .transactionMode("ONLINE")
                            .breadcrumb(request.getBreadcrumb())
                            .intendedWkstState("ACCOUNT_OVERVIEW")
                            .accounts(accounts.stream()
                                    .map(summary -> PinValidationResponse.AccountInfo.builder()
                                            .accountId(summary.getAccountId())
                                            .accountNumber(summary.getAccountNumber())
                                            .accountType(summary.getType().name())
                                            .balance(summary.getBalance())
                                            .currency(summary.getCurrency())
                                            .build())
                                    .toList())
                            .supportedTransactions(ENABLED_TRANSACTIONS)
                            .build();
                }));
    }

    /**
     * Phase 4. A cancelled result drops the overview snapshot; balances are never touched here.
     */
    public FinalizeResponse finalizeOverview(String token, FinalizeRequest request) {
        return sessionService.execute(token, session ->
                runPhase(session, ProtocolPhase.OVERVIEW_FINALIZED, request, FinalizeResponse.class, () -> {
                    String result = request.getClientTransactionResult().trim().toUpperCase(Locale.ROOT);
                    if (!RESULT_COMPLETED.equals(result) && !RESULT_CANCELLED.equals(result)) {
                        throw AtmException.validation("ClientTransactionResult must be Completed or Cancelled");
                    }
                    if (RESULT_CANCELLED.equals(result)) {
                        session.getOverview().clear();
                        log.info("Overview cancelled by client - sessionId: {}", session.getSessionId());
                    }
                    return FinalizeResponse.builder()
                            .responseCode(ResponseCode.APPROVED.getCode())
                            .extendedTransactionResponseCode(ResponseCode.APPROVED.getCode())
                            .clientTransactionResult(result)
                            .intendedWkstState("TRANSACTION_SELECTION")
                            .enabledTransactions(ENABLED_TRANSACTIONS)
                            .build();
                }));
    }

    /**
     * Phase 5. Re-verifies the PIN and withdraws through the transaction executor.
     * The session returns to OVERVIEW_FINALIZED so further transactions can follow.
     *
     * @throws AtmException BALANCE_ERROR, LIMIT_ERROR, PIN_ERROR or SEQUENCE_ERROR
     */
    public WithdrawalAuthorizeResponse authorizeWithdrawal(String token, WithdrawalAuthorizeRequest request) {
        return sessionService.execute(token, session -> {
            rejectLocked(session, ProtocolPhase.TRANSACTION_AUTHORIZED);

            PhaseOutcome stored = session.getAuthorizations().get(request.getHostTransactionNumber());
            if (stored != null) {
                if (stored.matches(request)) {
                    log.info("Authorization replayed - sessionId: {}, hostTransactionNumber: {}",
                            session.getSessionId(), request.getHostTransactionNumber());
                    return (WithdrawalAuthorizeResponse) stored.getResponse();
                }
                throw AtmException.validation("HostTransactionNumber " + request.getHostTransactionNumber() + " was already used");
            }
            requirePredecessor(session, ProtocolPhase.TRANSACTION_AUTHORIZED);

            pinService.verify(session, request.getEncryptedPinData());

            Account source = accountService.resolveOwnedAccount(session.getCustomerId(), request.getSourceAccount().getNumber());
            if (!source.getCurrency().equalsIgnoreCase(request.getCurrency())) {
                throw AtmException.validation("Currency " + request.getCurrency() + " does not match the account currency");
            }

            TransactionResult result = transactionExecutor.executeCommand(session, TransactionCommand.builder()
                    .operation(OperationType.WITHDRAW)
                    .fromAccountId(source.getId())
                    .amount(request.getRequestedAmount())
                    .currency(source.getCurrency())
                    .receiptMode(receiptModeOf(session))
                    .metadata(Map.of("hostTransactionNumber", request.getHostTransactionNumber()))
                    .build());

            AccountSummary debited = result.getUpdatedAccounts().get(0);
            WithdrawalAuthorizeResponse response = WithdrawalAuthorizeResponse.builder()
                    .responseCode(ResponseCode.APPROVED.getCode())
                    .actionCode(ResponseCode.APPROVED.getCode())
                    .messageSequenceNumber(request.getClientRequestNumber())
                    .hostTransactionNumber(request.getHostTransactionNumber())
                    .transactionId(result.getTransaction().getTransactionId())
                    .transactionAmount(result.getTransaction().getAmount())
                    .currency(debited.getCurrency())
                    .fractionDigits(FRACTION_DIGITS)
                    .debitedAccount(WithdrawalAuthorizeResponse.DebitedAccount.builder()
                            .accountNumber(debited.getAccountNumber())
                            .accountType(debited.getType().name())
                            .build())
                    .withdrawalDailyLimits(WithdrawalAuthorizeResponse.MoneyAmount.builder()
                            .amount(result.getRemainingLimits().getWithdrawal())
                            .currencyCode(debited.getCurrency())
                            .fractionDigits(FRACTION_DIGITS)
                            .build())
                    .accountInformation(WithdrawalAuthorizeResponse.MoneyAmount.builder()
                            .amount(debited.getBalance())
                            .currencyCode(debited.getCurrency())
                            .fractionDigits(FRACTION_DIGITS)
                            .build())
                    .emvAuthorizeResponseData(request.getEmvAuthorizeRequestData())
                    .enabledTransactions(ENABLED_TRANSACTIONS)
                    .build();

            session.getAuthorizations().put(request.getHostTransactionNumber(), new PhaseOutcome(request, response));
            session.setPhase(ProtocolPhase.TRANSACTION_AUTHORIZED.restingPhase());
            return response;
        });
    }

    /**
     * Archives the session's flows, intents and conversation, then drops the token. Expired sessions may log out.
     */
    public void logout(String token) {
        sessionService.executeIgnoringExpiry(token, session -> {
            sessionArchiveService.archive(session);
            return null;
        });
        sessionService.invalidate(token);
    }

    private <R> R runPhase(AtmSession session, ProtocolPhase phase, Object request, Class<R> responseType, Supplier<R> action) {
        rejectLocked(session, phase);

        PhaseOutcome stored = session.getPhaseOutcomes().get(phase);
        if (stored != null && stored.matches(request)) {
            log.info("Phase replayed - sessionId: {}, phase: {}", session.getSessionId(), phase);
            return responseType.cast(stored.getResponse());
        }
        requirePredecessor(session, phase);

        R response = action.get();
        session.getPhaseOutcomes().put(phase, new PhaseOutcome(request, response));
        session.setPhase(phase.restingPhase());
        log.info("Phase completed - sessionId: {}, phase: {}", session.getSessionId(), phase);
        return response;
    }

    private void rejectLocked(AtmSession session, ProtocolPhase phase) {
        if (!session.isLocked()) {
            return;
        }
        if (phase == ProtocolPhase.PIN_VALIDATED || phase == ProtocolPhase.TRANSACTION_AUTHORIZED) {
            throw AtmException.pinLockout("PIN tries exceeded, please login again");
        }
        throw AtmException.sequence("Session is locked, please login again");
    }

    private void requirePredecessor(AtmSession session, ProtocolPhase phase) {
        if (session.getPhase() != phase.getPredecessor()) {
            log.warn("Phase out of sequence - sessionId: {}, current: {}, requested: {}",
                    session.getSessionId(), session.getPhase(), phase);
            throw AtmException.sequence("Phase " + phase + " is not allowed after " + session.getPhase());
        }
    }

    private BigDecimal fastCashAmount(AtmSession session) {
        return cardResolverService.findCard(session.getCardId())
                .map(Card::getFastCashAmount)
                .orElse(null);
    }

    private static ReceiptMode receiptModeOf(AtmSession session) {
        return session.getPreferences() != null && session.getPreferences().getReceiptMode() != null
                ? session.getPreferences().getReceiptMode()
                : ReceiptMode.NONE;
    }

    static ReceiptMode parseReceiptMode(String value) {
        try {
            return ReceiptMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new AtmException(ErrorKind.VALIDATION_ERROR,
                    "ReceiptPreference must be one of PRINT, EMAIL, NONE", e);
        }
    }

    static String normalizeLanguage(String language) {
        String normalized = language.trim().toLowerCase(Locale.ROOT);
        if (!normalized.matches("[a-z]{2}")) {
            throw AtmException.validation("Language must be a two-letter code");
        }
        return normalized;
    }
}
