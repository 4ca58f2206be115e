package com.flint.controller;

import com.flint.dto.SubscriptionsResponse;
import com.flint.provider.bank.BankTransaction;
import com.flint.service.CurrentUserService;
import com.flint.service.SubscriptionService;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class SubscriptionController {
  private final SubscriptionService subscriptionService;
  private final CurrentUserService currentUserService;

  public SubscriptionController(SubscriptionService subscriptionService, CurrentUserService currentUserService) {
    this.subscriptionService = subscriptionService;
    this.currentUserService = currentUserService;
  }

  @GetMapping("/transactions")
  public List<BankTransaction> transactions() {
    return subscriptionService.listTransactions(currentUserService.requireUserId());
  }

  @GetMapping("/subscriptions")
  public SubscriptionsResponse subscriptions() {
    return subscriptionService.detectSubscriptions(currentUserService.requireUserId());
  }
}
