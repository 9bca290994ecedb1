package com.flamingo.ai.contextmemory.domain.repository;

import com.flamingo.ai.contextmemory.domain.entity.UserPreferences;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for UserPreferences entities. */
@Repository
public interface UserPreferencesRepository extends JpaRepository<UserPreferences, UUID> {

  Optional<UserPreferences> findByUserId(String userId);
}
