package com.tokentracker.backend.modules.token.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.tokentracker.backend.global.error.ProblemException;
import com.tokentracker.backend.modules.token.domain.BulkOperation;
import com.tokentracker.backend.modules.token.domain.TokenRecord;
import com.tokentracker.backend.modules.token.infrastructure.persistence.TokenRecordRepository;
import com.tokentracker.backend.modules.token.infrastructure.persistence.TokenSearchCondition;
import com.tokentracker.backend.modules.token.presentation.dto.BulkOperationRequest;
import com.tokentracker.backend.modules.token.presentation.dto.BulkOperationResponse;
import com.tokentracker.backend.modules.token.presentation.dto.TokenRequest;
import com.tokentracker.backend.modules.token.presentation.dto.TokenResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TokenRecordService {

    private static final Logger log = LoggerFactory.getLogger(TokenRecordService.class);

    static final String STATUS_COMPLETED = "Completed";
    static final String TOKEN_UNIQUE_CONSTRAINT = "uq_tokens_token";

    private final TokenRecordRepository tokenRecordRepository;
    private final Clock clock;

    public TokenRecordService(TokenRecordRepository tokenRecordRepository, Clock clock) {
        this.tokenRecordRepository = tokenRecordRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<TokenResponse> searchTokens(TokenSearchCondition condition) {
        return tokenRecordRepository.searchTokens(condition).stream()
                .map(TokenResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public TokenResponse getToken(Long id) {
        return TokenResponse.from(loadToken(id));
    }

    public TokenResponse createToken(TokenRequest request) {
        String token = request.token().trim();
        if (tokenRecordRepository.existsByToken(token)) {
            throw tokenConflict();
        }
        TokenRecord record = new TokenRecord();
        apply(record, request, token);
        return TokenResponse.from(persist(record));
    }

    public TokenResponse updateToken(Long id, TokenRequest request) {
        TokenRecord record = loadToken(id);
        String token = request.token().trim();
        if (tokenRecordRepository.existsByTokenAndIdNot(token, id)) {
            throw tokenConflict();
        }
        apply(record, request, token);
        return TokenResponse.from(persist(record));
    }

    @Transactional
    public void deleteToken(Long id) {
        tokenRecordRepository.delete(loadToken(id));
    }

    @Transactional
    public BulkOperationResponse applyBulkOperation(BulkOperationRequest request) {
        if (request == null || request.operation() == null || request.operation().isBlank()
                || request.ids() == null || request.ids().isEmpty()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "bulk.invalid_request", "Operation and IDs required");
        }
        BulkOperation operation = BulkOperation.fromWireName(request.operation())
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "bulk.unknown_operation",
                        "Unknown operation"));

        Set<Long> ids = new LinkedHashSet<>(request.ids());
        ids.removeIf(Objects::isNull);
        if (ids.isEmpty()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "bulk.invalid_request", "Operation and IDs required");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        int processed = switch (operation) {
            case APPLY_AGENT_PAYMENT -> tokenRecordRepository.applyAgentPayment(ids, now);
            case APPLY_EXECUTIVE_PAYMENT -> tokenRecordRepository.applyExecutivePayment(ids, now);
            case MARK_COMPLETED -> tokenRecordRepository.markCompleted(ids, STATUS_COMPLETED, LocalDate.now(clock), now);
        };
        log.info("Bulk operation {} updated {} of {} token(s)", operation.getWireName(), processed, ids.size());
        return new BulkOperationResponse(true, processed);
    }

    private TokenRecord persist(TokenRecord record) {
        try {
            return tokenRecordRepository.saveAndFlush(record);
        } catch (DataIntegrityViolationException ex) {
            if (isTokenUniqueViolation(ex)) {
                throw tokenConflict();
            }
            throw ex;
        }
    }

    static boolean isTokenUniqueViolation(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains(TOKEN_UNIQUE_CONSTRAINT);
    }

    private TokenRecord loadToken(Long id) {
        return tokenRecordRepository.findById(id)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "token.not_found", "Token not found"));
    }

    private ProblemException tokenConflict() {
        return new ProblemException(HttpStatus.CONFLICT, "token.duplicate", "Token already exists");
    }

    private static void apply(TokenRecord record, TokenRequest request, String token) {
        record.setDate(request.date());
        record.setCompletionDate(request.completionDate());
        record.setLocation(request.location());
        record.setSubLocation(request.subLocation());
        record.setToken(token);
        record.setPassword(request.password());
        record.setClientName(request.clientName());
        record.setContact(request.contact());
        record.setWhoWillShip(request.whoWillShip());
        record.setContactedClient(request.contactedClient());
        record.setStatus(request.status());
        record.setForwarded(request.forwarded());
        record.setCharges(request.charges());
        record.setPaymentReceived(request.paymentReceived());
        record.setChargesToExecutive(request.chargesToExecutive());
        record.setAgentName(request.agentName());
        record.setExecutiveName(request.executiveName());
        record.setProcessBy(request.processBy());
        record.recalculateAmounts();
    }
}
