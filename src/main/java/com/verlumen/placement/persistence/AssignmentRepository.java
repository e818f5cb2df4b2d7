package com.verlumen.placement.persistence;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Storage for saved placements. Failures propagate to the caller; writes are not retried. */
public interface AssignmentRepository {
  ImmutableList<AssignmentRecord> findByFiscalYear(int fiscalYear);

  /**
   * Deletes every record of the fiscal year and stores {@code records} in their place.
   *
   * @return the number of records stored
   */
  int replaceFiscalYear(int fiscalYear, List<AssignmentRecord> records);
}
