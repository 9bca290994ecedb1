package com.flamingo.ai.contextmemory.domain.repository;

import com.flamingo.ai.contextmemory.domain.entity.SessionState;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for SessionState entities. */
@Repository
public interface SessionStateRepository extends JpaRepository<SessionState, UUID> {

  Optional<SessionState> findByUserIdAndSessionId(String userId, String sessionId);

  /** Marks every other live session of the user as superseded. */
  @Modifying
  @Query(
      "UPDATE SessionState s SET s.superseded = true "
          + "WHERE s.userId = :userId AND s.sessionId <> :sessionId AND s.superseded = false")
  int supersedeOthers(@Param("userId") String userId, @Param("sessionId") String sessionId);
}
