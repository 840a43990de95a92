package com.poisearch.service;

import com.poisearch.model.PointOfInterest;
import com.poisearch.model.SearchCriteria;
import com.poisearch.model.param.CreatePoiParam;
import com.poisearch.model.result.IndexStats;
import com.poisearch.model.result.PoiIdResult;
import com.poisearch.model.result.PoiSearchResult;

/**
 * Points of interest operations
 */
public interface PoiService {
    
    /**
     * Create a point of interest. It shows up in searches after the next index
     * refresh, at most one staleness window later.
     */
    PoiIdResult create(CreatePoiParam param);
    
    /**
     * Delete a point of interest; effective when the enclosing transaction commits
     */
    void delete(long id);
    
    /**
     * Read a point of interest back from the store
     */
    PointOfInterest get(long id);
    
    /**
     * Search an area for one category, or ask the caller to zoom in when too many match
     */
    PoiSearchResult search(SearchCriteria criteria);
    
    /**
     * Statistics of the index
     */
    IndexStats stats();
    
    /**
     * Drop the index; the next search rebuilds it from the store
     */
    boolean resetIndex();
}
