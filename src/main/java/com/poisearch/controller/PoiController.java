package com.poisearch.controller;

import com.poisearch.aspect.TimingAspect;
import com.poisearch.exception.PoiValidationException;
import com.poisearch.model.PointOfInterest;
import com.poisearch.model.SearchCriteria;
import com.poisearch.model.param.AreaAndCategoryParam;
import com.poisearch.model.param.CreatePoiParam;
import com.poisearch.model.param.PoiIdParam;
import com.poisearch.model.result.ApiResponse;
import com.poisearch.model.result.IndexStats;
import com.poisearch.model.result.PoiIdResult;
import com.poisearch.model.result.PoiSearchResult;
import com.poisearch.service.PoiService;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * HTTP JSON API for points of interest.
 * Service paths keep the names clients already use: poi_create, poi_delete, poi_search.
 * Errors are rendered by {@link com.poisearch.exception.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1")
@Slf4j
public class PoiController {
    
    @Autowired
    private PoiService poiService;
    
    /**
     * HTTP: POST /api/v1/poi_create
     */
    @PostMapping("/poi_create")
    public ResponseEntity<ApiResponse<PoiIdResult>> create(@RequestBody CreatePoiParam param) {
        log.debug("poi_create {}", param);
        PoiIdResult result = poiService.create(param);
        return ResponseEntity.ok(ApiResponse.success(result, TimingAspect.getAndClearExecutionTime()));
    }
    
    /**
     * HTTP: POST /api/v1/poi_delete
     */
    @PostMapping("/poi_delete")
    public ResponseEntity<ApiResponse<Void>> delete(@RequestBody PoiIdParam param) {
        if (param.getId() == null) {
            throw PoiValidationException.idMissing();
        }
        log.debug("poi_delete {}", param.getId());
        poiService.delete(param.getId());
        return ResponseEntity.ok(ApiResponse.success(null, TimingAspect.getAndClearExecutionTime()));
    }
    
    /**
     * HTTP: POST /api/v1/poi_search
     * The reply holds either a (possibly empty) list of points or zoom_in = true.
     */
    @PostMapping("/poi_search")
    public ResponseEntity<ApiResponse<PoiSearchResult>> search(@RequestBody AreaAndCategoryParam param) {
        SearchCriteria criteria = param.toCriteria();
        log.debug("poi_search {}", criteria);
        PoiSearchResult result = poiService.search(criteria);
        return ResponseEntity.ok(ApiResponse.success(result, TimingAspect.getAndClearExecutionTime()));
    }
    
    /**
     * HTTP: GET /api/v1/pois/{id}
     */
    @GetMapping("/pois/{id}")
    public ResponseEntity<ApiResponse<PointOfInterest>> get(@PathVariable long id) {
        return ResponseEntity.ok(ApiResponse.success(poiService.get(id)));
    }
    
    /**
     * HTTP: GET /api/v1/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<IndexStats>> stats() {
        return ResponseEntity.ok(ApiResponse.success(poiService.stats()));
    }
    
    /**
     * HTTP: POST /api/v1/index/reset
     */
    @PostMapping("/index/reset")
    public ResponseEntity<ApiResponse<Map<String, Boolean>>> resetIndex() {
        boolean dropped = poiService.resetIndex();
        return ResponseEntity.ok(ApiResponse.success(Map.of("dropped", dropped), TimingAspect.getAndClearExecutionTime()));
    }
}
