package com.monthledger.repository;

import com.monthledger.model.PendingSettingsWrite;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PendingSettingsWriteRepository extends JpaRepository<PendingSettingsWrite, Integer> {}
