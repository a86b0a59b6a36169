package com.tokentracker.backend.modules.token.infrastructure.persistence;

import java.util.List;

import com.tokentracker.backend.modules.token.domain.TokenRecord;

public interface TokenRecordRepositoryCustom {

    List<TokenRecord> searchTokens(TokenSearchCondition condition);
}
