package com.monthledger.controller;

import com.monthledger.dto.SessionRequest;
import com.monthledger.dto.SessionResponse;
import com.monthledger.service.SessionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/session")
public class SessionController {
  private final SessionService sessionService;

  public SessionController(SessionService sessionService) {
    this.sessionService = sessionService;
  }

  @PostMapping
  public SessionResponse open(@Valid @RequestBody SessionRequest request) {
    return sessionService.open(request.getUserId(), request.getAccessToken());
  }

  @GetMapping
  public SessionResponse current() {
    return sessionService.current();
  }

  @DeleteMapping
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void close() {
    sessionService.close();
  }
}
