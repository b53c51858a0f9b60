package com.quantori.cnp.api.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Conflict {
  ConflictType type;
  String ruleId;
  String message;

  public static Conflict of(ConflictType type, String ruleId, String message) {
    return new Conflict(type, ruleId, message);
  }
}
