package com.monthledger.controller;

import com.monthledger.dto.ConnectivityRequest;
import com.monthledger.dto.SyncStatusResponse;
import com.monthledger.service.SyncStatusService;
import com.monthledger.sync.FlushReport;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sync")
public class SyncController {
  private final SyncStatusService syncStatusService;

  public SyncController(SyncStatusService syncStatusService) {
    this.syncStatusService = syncStatusService;
  }

  @GetMapping("/status")
  public SyncStatusResponse status() {
    return syncStatusService.status();
  }

  @PostMapping("/flush")
  public FlushReport flush() {
    return syncStatusService.flush();
  }

  @PutMapping("/connectivity")
  public SyncStatusResponse connectivity(@Valid @RequestBody ConnectivityRequest request) {
    return syncStatusService.setOnline(request.getOnline());
  }
}
