package com.flamingo.ai.nexuschat.api.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for creating a new session. A blank title gets a default. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSessionRequest {

  @Size(max = 255, message = "Title must be at most 255 characters")
  private String title;
}
