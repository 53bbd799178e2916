package com.schemalens.core.extract;

import com.schemalens.core.adapter.DialectAdapter;
import com.schemalens.core.catalog.CatalogReader;

/**
 * One database to extract in a batch. Each job must bring its own reader, since readers are
 * not shared between threads.
 */
public record ExtractionJob(String name, DialectAdapter adapter, CatalogReader reader, ExtractionConfig config) {}
