package com.flamingo.dozor.domain;

import java.util.List;

/**
 * Everything read from one dozor log.
 *
 * @param records one record per result row, in log order
 * @param halfDoseTime half-dose time reported by radiation-damage runs, or null
 */
public record DecodedLog(List<ImageResultRecord> records, Double halfDoseTime) {

  public DecodedLog {
    records = List.copyOf(records);
  }
}
