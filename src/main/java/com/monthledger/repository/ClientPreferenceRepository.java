package com.monthledger.repository;

import com.monthledger.model.ClientPreference;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ClientPreferenceRepository extends JpaRepository<ClientPreference, String> {}
