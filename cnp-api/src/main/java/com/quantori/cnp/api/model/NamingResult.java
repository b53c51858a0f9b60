package com.quantori.cnp.api.model;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of one naming run. A name is always present, degraded results carry conflicts and a lower confidence.
 */
@Value
@Builder
public class NamingResult {
  String name;
  double confidence;
  @Singular
  List<Conflict> conflicts;
  @Singular("auditEntry")
  List<RuleApplication> auditLog;

  public boolean hasConflict(ConflictType type) {
    return conflicts.stream().anyMatch(conflict -> conflict.getType() == type);
  }
}
