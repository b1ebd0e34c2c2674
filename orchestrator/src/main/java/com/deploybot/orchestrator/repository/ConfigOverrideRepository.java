package com.deploybot.orchestrator.repository;

import com.deploybot.orchestrator.model.ConfigOverride;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Store-backed per-project configuration overrides.
 */
public interface ConfigOverrideRepository extends JpaRepository<ConfigOverride, Long> {

    List<ConfigOverride> findAllByOrderByProjectAscKeyAsc();
}
