package com.monthledger.repository;

import com.monthledger.model.PendingMonthWrite;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PendingMonthWriteRepository extends JpaRepository<PendingMonthWrite, String> {
  List<PendingMonthWrite> findAllByOrderByMonthKeyAsc();
}
