package com.poisearch.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of poi_search.
 * <p>
 * Either a list of hits (possibly empty, meaning nothing matched) or the zoom-in
 * signal, meaning more points match than can be displayed and the client has to
 * narrow the area. The two are never combined.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PoiSearchResult {

    private List<PoiSummary> pois;

    @JsonProperty("zoom_in")
    private boolean zoomIn;

    public static PoiSearchResult of(List<PoiSummary> pois) {
        return new PoiSearchResult(Collections.unmodifiableList(pois), false);
    }

    public static PoiSearchResult zoomIn() {
        return new PoiSearchResult(null, true);
    }
}
