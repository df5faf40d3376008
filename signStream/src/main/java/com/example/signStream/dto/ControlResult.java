package com.example.signStream.dto;

import com.example.signStream.error.ErrorType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of every practice-session control call, successful or not.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ControlResult {

  private boolean success;
  private String action;
  private String error;
  private String errorType;

  private String sessionId;
  private String currentSentence;
  private Integer currentSentenceIndex;
  private Integer totalSentences;
  private String practiceMode;

  @JsonProperty("is_last_sentence")
  private Boolean lastSentence;

  private Object feedback;

  public static ControlResult failure(String action, ErrorType type, String error) {
    return ControlResult.builder()
        .success(false)
        .action(action)
        .errorType(type.wireName())
        .error(error)
        .build();
  }
}
