package com.flint.controller;

import com.flint.dto.DashboardResponse;
import com.flint.service.AccountMerger;
import com.flint.service.CurrentUserService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class DashboardController {
  private final AccountMerger accountMerger;
  private final CurrentUserService currentUserService;

  public DashboardController(AccountMerger accountMerger, CurrentUserService currentUserService) {
    this.accountMerger = accountMerger;
    this.currentUserService = currentUserService;
  }

  @GetMapping("/dashboard")
  public DashboardResponse dashboard() {
    return accountMerger.buildDashboardView(currentUserService.requireUserId());
  }
}
