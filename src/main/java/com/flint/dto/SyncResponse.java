package com.flint.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SyncResponse {
  private List<ConnectionResponse> connections;
  private int added;
  private int updated;
  private int rejected;
  private Integer limit;
  private String message;
}
