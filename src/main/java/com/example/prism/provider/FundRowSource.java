package com.example.prism.provider;

import java.time.LocalDate;
import java.util.List;

/**
 * Supplies the full fund price table for a date. Starts its session lazily
 * on the first fetch; {@link #close()} tears it down and the next fetch
 * starts a new one.
 */
public interface FundRowSource extends AutoCloseable {

  List<FundRow> fetchRows(LocalDate date, Deadline deadline) throws ProviderException;

  boolean isReady();

  @Override
  void close();
}
