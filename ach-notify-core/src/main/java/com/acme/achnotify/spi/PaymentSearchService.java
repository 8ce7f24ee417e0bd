package com.acme.achnotify.spi;

/** Runs the externally maintained search that selects eligible ACH payments. */
public interface PaymentSearchService {

  /**
   * @throws com.acme.achnotify.core.ConfigurationException when the search does not exist
   */
  SearchResultSet runSearch(String searchId);
}
