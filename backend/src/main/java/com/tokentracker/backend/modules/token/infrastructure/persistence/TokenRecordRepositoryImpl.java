package com.tokentracker.backend.modules.token.infrastructure.persistence;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

import com.tokentracker.backend.modules.token.domain.TokenRecord;

@Repository
public class TokenRecordRepositoryImpl implements TokenRecordRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<TokenRecord> searchTokens(TokenSearchCondition condition) {
        Objects.requireNonNull(condition, "condition must not be null");

        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();

        if (isActive(condition.location())) {
            whereClauses.add("lower(t.location) = :location");
            params.put("location", condition.location().trim().toLowerCase(Locale.ROOT));
        }

        if (isActive(condition.status())) {
            whereClauses.add("lower(t.status) = :status");
            params.put("status", condition.status().trim().toLowerCase(Locale.ROOT));
        }

        if (StringUtils.hasText(condition.keyword())) {
            whereClauses.add("""
                    (lower(t.token) like :keyword
                     or lower(t.clientName) like :keyword
                     or lower(t.contact) like :keyword
                     or lower(t.subLocation) like :keyword)""");
            params.put("keyword", "%" + escapeLike(condition.keyword().trim().toLowerCase(Locale.ROOT)) + "%");
        }

        if (isActive(condition.agentName())) {
            whereClauses.add("t.agentName = :agentName");
            params.put("agentName", condition.agentName());
        }

        if (isActive(condition.executiveName())) {
            whereClauses.add("t.executiveName = :executiveName");
            params.put("executiveName", condition.executiveName());
        }

        if (condition.fromDate() != null && condition.toDate() != null) {
            whereClauses.add("t.date between :fromDate and :toDate");
            params.put("fromDate", condition.fromDate());
            params.put("toDate", condition.toDate());
        }

        String whereJpql = whereClauses.isEmpty() ? "" : " where " + String.join(" and ", whereClauses);
        String jpql = "select t from TokenRecord t" + whereJpql
                + " order by t.date desc nulls last, t.createdAt desc, t.id desc";

        TypedQuery<TokenRecord> query = entityManager.createQuery(jpql, TokenRecord.class);
        params.forEach(query::setParameter);
        return query.getResultList();
    }

    private static boolean isActive(String filter) {
        return StringUtils.hasText(filter) && !TokenSearchCondition.ALL.equalsIgnoreCase(filter.trim());
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
