package com.poisearch.model.param;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.poisearch.exception.PoiValidationException;
import com.poisearch.model.Category;
import com.poisearch.model.Interval;
import com.poisearch.model.SearchCriteria;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of poi_search: a latitude/longitude rectangle and one category
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AreaAndCategoryParam {

    @JsonProperty("latitude_min")
    private Double latitudeMin;

    @JsonProperty("latitude_max")
    private Double latitudeMax;

    @JsonProperty("longitude_min")
    private Double longitudeMin;

    @JsonProperty("longitude_max")
    private Double longitudeMax;

    private Category category;

    /**
     * Convert to validated search criteria.
     *
     * @throws PoiValidationException if a bound is missing or the area is malformed
     */
    public SearchCriteria toCriteria() {
        if (latitudeMin == null || latitudeMax == null || longitudeMin == null || longitudeMax == null) {
            throw PoiValidationException.badArea("all four bounds are required");
        }
        return new SearchCriteria(Interval.of(latitudeMin, latitudeMax),
                Interval.of(longitudeMin, longitudeMax), category);
    }
}
