package com.flint.controller;

import com.flint.dto.ActivityResponse;
import com.flint.dto.HoldingsResponse;
import com.flint.service.CurrentUserService;
import com.flint.service.DisconnectService;
import com.flint.service.HoldingService;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/accounts")
public class AccountController {
  private final DisconnectService disconnectService;
  private final HoldingService holdingService;
  private final CurrentUserService currentUserService;

  public AccountController(DisconnectService disconnectService,
                           HoldingService holdingService,
                           CurrentUserService currentUserService) {
    this.disconnectService = disconnectService;
    this.holdingService = holdingService;
    this.currentUserService = currentUserService;
  }

  @DeleteMapping("/{provider}/{id}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void disconnect(@PathVariable String provider, @PathVariable String id) {
    disconnectService.disconnect(currentUserService.requireUserId(), provider, id);
  }

  @GetMapping("/brokerage/{accountId}/holdings")
  public HoldingsResponse holdings(@PathVariable String accountId) {
    return holdingService.refreshHoldings(currentUserService.requireUserId(), accountId);
  }

  @GetMapping("/brokerage/{accountId}/activities")
  public List<ActivityResponse> activities(@PathVariable String accountId) {
    return holdingService.listActivities(currentUserService.requireUserId(), accountId);
  }
}
