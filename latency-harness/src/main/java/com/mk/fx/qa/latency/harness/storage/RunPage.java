package com.mk.fx.qa.latency.harness.storage;

import com.mk.fx.qa.latency.harness.model.TestRun;
import java.util.List;

/**
 * One page of a run listing.
 *
 * @param runs runs in the page
 * @param total number of runs matching the filters, across all pages
 */
public record RunPage(List<TestRun> runs, int total) {}
