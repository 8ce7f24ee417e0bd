package com.acme.achnotify.spi;

import com.acme.achnotify.domain.RawPaymentRecord;
import java.util.List;

/** Paged view over the rows of a saved search. */
public interface SearchResultSet {

  /** Total number of rows, known before iterating. */
  long count();

  /**
   * Fetches one page of rows.
   *
   * @param pageIndex zero-based page number
   * @param pageSize maximum rows per page
   * @return the rows of that page; empty past the last page
   */
  List<RawPaymentRecord> page(int pageIndex, int pageSize);
}
