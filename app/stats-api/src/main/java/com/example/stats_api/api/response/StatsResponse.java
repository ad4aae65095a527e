package com.example.stats_api.api.response;

import com.example.stats_api.model.StatsResult;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "document は ResultDocument が凍結済みの不変 Map をそのまま保持するため")
public record StatsResponse(String identifier, String period, Map<String, Object> document) {

  public static StatsResponse from(StatsResult result) {
    return new StatsResponse(
        result.identifier().value(), result.period().value(), result.document().content());
  }
}
