package com.poisearch.service.impl;

import com.poisearch.aspect.Timed;
import com.poisearch.config.PoiSearchProperties;
import com.poisearch.exception.PoiNotFoundException;
import com.poisearch.exception.PoiValidationException;
import com.poisearch.index.IndexSearchResult;
import com.poisearch.index.IndexedPoi;
import com.poisearch.index.PoiIndex;
import com.poisearch.index.PoiIndexRegistry;
import com.poisearch.model.PointOfInterest;
import com.poisearch.model.SearchCriteria;
import com.poisearch.model.param.CreatePoiParam;
import com.poisearch.model.result.IndexStats;
import com.poisearch.model.result.PoiIdResult;
import com.poisearch.model.result.PoiSearchResult;
import com.poisearch.model.result.PoiSummary;
import com.poisearch.repository.PoiStore;
import com.poisearch.service.PoiService;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Implementation of PoiService: mutations go to the store, searches to the index.
 * Mutations run in a transaction committed on return and rolled back on any exception.
 */
@Service
public class PoiServiceImpl implements PoiService {
    
    private static final Logger logger = LoggerFactory.getLogger(PoiServiceImpl.class);
    
    @Autowired
    private PoiStore poiStore;
    
    @Autowired
    private PoiIndexRegistry indexRegistry;
    
    @Autowired
    private PoiSearchProperties properties;
    
    @Override
    @Transactional
    @Timed("poi_create")
    public PoiIdResult create(CreatePoiParam param) {
        if (!param.hasPosition()) {
            throw PoiValidationException.positionMissing();
        }
        if (!param.getPosition().isWithinRange()) {
            throw PoiValidationException.positionOutOfRange();
        }
        if (param.getCategory() == null) {
            throw PoiValidationException.categoryMissing();
        }
        
        PointOfInterest created = poiStore.create(param.getName(), param.getPosition().copy(), param.getCategory());
        logger.debug("Created point of interest {} ({}) at {}", created.getId(), created.getCategory(), created.getPosition());
        return new PoiIdResult(created.getId());
    }
    
    @Override
    @Transactional
    @Timed("poi_delete")
    public void delete(long id) {
        poiStore.get(id).orElseThrow(() -> new PoiNotFoundException(id));
        if (!poiStore.markForRemoval(id)) {
            // Removed by a concurrent transaction since the lookup
            throw new PoiNotFoundException(id);
        }
        logger.debug("Marked point of interest {} for removal", id);
    }
    
    @Override
    @Transactional(readOnly = true)
    public PointOfInterest get(long id) {
        return poiStore.get(id).orElseThrow(() -> new PoiNotFoundException(id));
    }
    
    @Override
    @Timed("poi_search")
    public PoiSearchResult search(SearchCriteria criteria) {
        int displayCap = properties.getQuery().getDisplayCap();
        PoiIndex index = indexRegistry.acquire(poiStore);
        
        IndexSearchResult found = index.search(criteria, displayCap);
        if (found.isTruncated()) {
            logger.debug("More than {} points match {}, asking to zoom in", displayCap, criteria);
            return PoiSearchResult.zoomIn();
        }
        
        List<PoiSummary> pois = found.getMatches().stream()
                .map(IndexedPoi::toSummary)
                .collect(Collectors.toList());
        logger.debug("Found {} points matching {}", pois.size(), criteria);
        return PoiSearchResult.of(pois);
    }
    
    @Override
    public IndexStats stats() {
        return indexRegistry.find(poiStore.getName())
                .map(PoiIndex::stats)
                .orElseGet(() -> IndexStats.builder()
                        .name(properties.getIndex().getName())
                        .store(poiStore.getName())
                        .built(false)
                        .build());
    }
    
    @Override
    @Timed(value = "poi_index_reset", logLevel = Timed.LogLevel.INFO)
    public boolean resetIndex() {
        boolean dropped = indexRegistry.reset(poiStore.getName());
        logger.info("Index reset requested for store '{}', dropped: {}", poiStore.getName(), dropped);
        return dropped;
    }
}
