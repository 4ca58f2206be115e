package com.flint.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LinkResult {
  private int accountsSaved;
  private int accountsRejected;
  private int duplicates;
  // null when unlimited
  private Integer limit;
  private long current;
  private String message;
  private List<DashboardAccount> accounts;

  @JsonIgnore
  public boolean isLimitReached() {
    return accountsSaved == 0 && accountsRejected > 0;
  }
}
