package com.flint.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class LinkBankRequest {
  @NotBlank
  @Size(max = 512)
  private String accessToken;

  @Size(max = 128)
  private String enrollmentId;

  @Size(max = 200)
  private String institutionName;
}
