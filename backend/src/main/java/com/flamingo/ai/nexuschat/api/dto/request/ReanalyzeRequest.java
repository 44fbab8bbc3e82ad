package com.flamingo.ai.nexuschat.api.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for re-describing an image. The default instruction is used when blank. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReanalyzeRequest {

  @Size(max = 2000, message = "Prompt must be at most 2000 characters")
  private String prompt;
}
