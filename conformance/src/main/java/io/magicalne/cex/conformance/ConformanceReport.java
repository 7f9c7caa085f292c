package io.magicalne.cex.conformance;

import io.magicalne.cex.dto.CexExchange;
import lombok.Data;

@Data
public class ConformanceReport {
  private final CexExchange exchange;
  private final int normalizedCount;
  private final int referenceCount;
  // raw listing vs. its own normalized output
  private final boolean selfConsistent;
  private final boolean equivalent;

  public boolean passed() {
    return selfConsistent && equivalent;
  }
}
