package com.seismic.sentinel.monitor.service.feed;

import com.seismic.sentinel.monitor.common.exception.FeedFetchException;
import com.seismic.sentinel.monitor.model.FeedBatch;

/**
 * Fetches the configured feed once. Retrying is left to the caller's schedule.
 */
public interface FeedClient {

    /**
     * @return parsed events plus the number of malformed features that were skipped
     * @throws FeedFetchException on transport failure, non-success status or an unparsable payload
     */
    FeedBatch fetch() throws FeedFetchException;
}
