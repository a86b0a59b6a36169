package com.tokentracker.backend.modules.token.infrastructure.persistence;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

import com.tokentracker.backend.modules.token.domain.TokenRecord;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TokenRecordRepository extends JpaRepository<TokenRecord, Long>, TokenRecordRepositoryCustom {

    boolean existsByToken(String token);

    boolean existsByTokenAndIdNot(String token, Long id);

    List<TokenRecord> findAllByOrderByIdAsc();

    List<TokenRecord> findByAgentNameAndCompletionDateIsNotNullOrderByCompletionDateAscIdAsc(String agentName);

    List<TokenRecord> findByExecutiveNameAndCompletionDateIsNotNullOrderByCompletionDateDescIdDesc(String executiveName);

    @Query("""
            select distinct t.agentName
              from TokenRecord t
             where t.agentName is not null
               and trim(t.agentName) <> ''
             order by t.agentName
            """)
    List<String> findDistinctAgentNames();

    @Query("""
            select distinct t.executiveName
              from TokenRecord t
             where t.executiveName is not null
               and trim(t.executiveName) <> ''
             order by t.executiveName
            """)
    List<String> findDistinctExecutiveNames();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update TokenRecord t
               set t.agentPaymentApplied = true,
                   t.paymentReceived = t.charges,
                   t.amountDue = 0,
                   t.updatedAt = :now
             where t.id in :ids
            """)
    int applyAgentPayment(@Param("ids") Collection<Long> ids, @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update TokenRecord t
               set t.executivePaymentApplied = true,
                   t.chargesToExecutive = t.charges,
                   t.margin = 0,
                   t.updatedAt = :now
             where t.id in :ids
            """)
    int applyExecutivePayment(@Param("ids") Collection<Long> ids, @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update TokenRecord t
               set t.status = :status,
                   t.completionDate = :completionDate,
                   t.updatedAt = :now
             where t.id in :ids
            """)
    int markCompleted(
            @Param("ids") Collection<Long> ids,
            @Param("status") String status,
            @Param("completionDate") LocalDate completionDate,
            @Param("now") OffsetDateTime now
    );
}
