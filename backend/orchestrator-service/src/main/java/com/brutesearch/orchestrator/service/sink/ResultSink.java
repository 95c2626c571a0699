package com.brutesearch.orchestrator.service.sink;

import com.brutesearch.orchestrator.dto.ResultRecord;

import java.io.IOException;
import java.util.List;

/**
 * Destination for admitted results (file export, index, database ...).
 * Called once per finished source with that source's new records.
 */
public interface ResultSink {

    void accept(String jobId, List<ResultRecord> records) throws IOException;
}
