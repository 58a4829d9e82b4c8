package com.monthledger.repository;

import com.monthledger.model.PendingMonthDelete;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PendingMonthDeleteRepository extends JpaRepository<PendingMonthDelete, String> {
  List<PendingMonthDelete> findAllByOrderByMonthKeyAsc();
}
