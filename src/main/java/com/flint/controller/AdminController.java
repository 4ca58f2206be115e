package com.flint.controller;

import com.flint.service.CurrentUserService;
import com.flint.service.JobStatus;
import com.flint.service.OrphanedConnectionCleanup;
import java.util.UUID;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/jobs")
public class AdminController {
  private final OrphanedConnectionCleanup orphanedConnectionCleanup;
  private final CurrentUserService currentUserService;

  public AdminController(OrphanedConnectionCleanup orphanedConnectionCleanup,
                         CurrentUserService currentUserService) {
    this.orphanedConnectionCleanup = orphanedConnectionCleanup;
    this.currentUserService = currentUserService;
  }

  @GetMapping("/orphan-cleanup")
  public JobStatus cleanupStatus() {
    requireAdmin();
    return orphanedConnectionCleanup.status();
  }

  @PostMapping("/orphan-cleanup")
  public JobStatus runCleanup() {
    requireAdmin();
    return orphanedConnectionCleanup.runSweep();
  }

  private void requireAdmin() {
    UUID userId = currentUserService.requireUserId();
    currentUserService.requireAdmin(userId);
  }
}
