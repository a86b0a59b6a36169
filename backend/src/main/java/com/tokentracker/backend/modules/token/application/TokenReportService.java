package com.tokentracker.backend.modules.token.application;

import java.util.List;

import com.tokentracker.backend.global.error.ProblemException;
import com.tokentracker.backend.modules.token.infrastructure.persistence.TokenRecordRepository;
import com.tokentracker.backend.modules.token.presentation.dto.TokenResponse;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional(readOnly = true)
public class TokenReportService {

    private final TokenRecordRepository tokenRecordRepository;

    public TokenReportService(TokenRecordRepository tokenRecordRepository) {
        this.tokenRecordRepository = tokenRecordRepository;
    }

    public List<String> listAgents() {
        return tokenRecordRepository.findDistinctAgentNames();
    }

    public List<String> listExecutives() {
        return tokenRecordRepository.findDistinctExecutiveNames();
    }

    /**
     * Completed tokens for one agent, oldest completion first.
     */
    public List<TokenResponse> agentReport(String agent) {
        if (!StringUtils.hasText(agent)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "missing_parameter", "Agent parameter required");
        }
        return tokenRecordRepository.findByAgentNameAndCompletionDateIsNotNullOrderByCompletionDateAscIdAsc(agent)
                .stream()
                .map(TokenResponse::from)
                .toList();
    }

    /**
     * Completed tokens for one executive, latest completion first.
     */
    public List<TokenResponse> executiveReport(String executive) {
        if (!StringUtils.hasText(executive)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "missing_parameter", "Executive parameter required");
        }
        return tokenRecordRepository
                .findByExecutiveNameAndCompletionDateIsNotNullOrderByCompletionDateDescIdDesc(executive)
                .stream()
                .map(TokenResponse::from)
                .toList();
    }
}
