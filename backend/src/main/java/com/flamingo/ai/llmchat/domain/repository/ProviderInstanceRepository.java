package com.flamingo.ai.llmchat.domain.repository;

import com.flamingo.ai.llmchat.domain.entity.ProviderInstance;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for ProviderInstance entities. */
@Repository
public interface ProviderInstanceRepository extends JpaRepository<ProviderInstance, String> {

  List<ProviderInstance> findAllByOrderByNameAsc();
}
