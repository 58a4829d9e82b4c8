package com.monthledger.repository;

import com.monthledger.model.MonthSnapshot;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MonthSnapshotRepository extends JpaRepository<MonthSnapshot, String> {
  List<MonthSnapshot> findAllByOrderByMonthKeyAsc();
}
