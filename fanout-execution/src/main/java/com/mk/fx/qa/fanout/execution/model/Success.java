package com.mk.fx.qa.fanout.execution.model;

import com.mk.fx.qa.fanout.client.SubFetchResult;
import java.util.Map;
import java.util.Objects;

/**
 * Both sub-fetches of a unit completed.
 *
 * @param unitId unit identifier
 * @param mergedResults sub-fetch results keyed by source name
 * @param processedAt formatted time at which the results were merged
 */
public record Success(String unitId, Map<String, SubFetchResult> mergedResults, String processedAt)
    implements ProcessedUnit {

  public Success {
    Objects.requireNonNull(unitId, "unitId");
    mergedResults = Map.copyOf(mergedResults);
  }

  @Override
  public boolean isSuccess() {
    return true;
  }
}
