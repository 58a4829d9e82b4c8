package com.monthledger.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.monthledger.service.SettingsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/settings")
public class SettingsController {
  private final SettingsService settingsService;

  public SettingsController(SettingsService settingsService) {
    this.settingsService = settingsService;
  }

  @GetMapping
  public JsonNode get() {
    return settingsService.current();
  }

  @PatchMapping
  public JsonNode patch(@RequestBody JsonNode patch) {
    return settingsService.patch(patch);
  }
}
