package com.streamearn.repository;

import com.streamearn.model.SessionState;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Optional;

@Repository
public interface SessionStateRepository extends JpaRepository<SessionState, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("select s from SessionState s where s.identity = :identity")
    Optional<SessionState> findByIdentityForUpdate(@Param("identity") String identity);

    @Modifying
    @Query(value = """
            INSERT INTO session_state (identity, continuous_seconds, updated_at)
            VALUES (:identity, 0, :now)
            ON CONFLICT (identity) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("identity") String identity, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("delete from SessionState s where s.lastActivityAt is null or s.lastActivityAt < :cutoff")
    int deleteIdleSince(@Param("cutoff") OffsetDateTime cutoff);
}
