package com.flint.model;

public enum SubscriptionTier {
  FREE,
  BASIC,
  PRO,
  PREMIUM
}
