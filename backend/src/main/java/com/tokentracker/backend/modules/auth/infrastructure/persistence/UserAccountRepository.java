package com.tokentracker.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import com.tokentracker.backend.modules.auth.domain.UserAccount;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface UserAccountRepository extends JpaRepository<UserAccount, Long> {

    Optional<UserAccount> findByUsername(String username);

    boolean existsByUsername(String username);

    List<UserAccount> findAllByOrderByIdAsc();

    /**
     * Replaces the stored credential in one statement keyed by the unique username.
     *
     * @return number of rows changed, 0 when the account no longer exists
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update UserAccount ua
               set ua.credential = :credential,
                   ua.updatedAt = :updatedAt
             where ua.username = :username
            """)
    int updateCredential(
            @Param("username") String username,
            @Param("credential") String credential,
            @Param("updatedAt") OffsetDateTime updatedAt
    );

    /**
     * @return 1 when the row was inserted, 0 when the username already existed
     */
    @Transactional
    @Modifying
    @Query(value = """
            INSERT INTO users (username, password, role, status, created_at, updated_at)
            VALUES (:username, :credential, :role, 'Active', :now, :now)
            ON CONFLICT (username) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(
            @Param("username") String username,
            @Param("credential") String credential,
            @Param("role") String role,
            @Param("now") OffsetDateTime now
    );
}
