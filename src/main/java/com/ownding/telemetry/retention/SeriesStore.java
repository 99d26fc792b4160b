package com.ownding.telemetry.retention;

import java.util.Collection;
import java.util.List;

/**
 * Storage access the enforcer needs. Both calls are made inside the same transaction for one attempt.
 */
public interface SeriesStore {

    List<Long> rankedIds(SeriesKey key);

    int deleteByIds(SeriesKey key, Collection<Long> ids);
}
