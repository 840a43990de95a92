package com.poisearch.index;

import com.poisearch.model.Category;
import com.poisearch.model.PointOfInterest;
import com.poisearch.model.Position;
import com.poisearch.model.result.PoiSummary;
import lombok.Value;

/**
 * Tuple held by the index for one point of interest
 */
@Value
public class IndexedPoi {

    static final int LATITUDE = 0;
    static final int LONGITUDE = 1;
    static final int CATEGORY = 2;

    long id;
    String name;
    double latitude;
    double longitude;
    Category category;
    long lastModified;

    public static IndexedPoi from(PointOfInterest poi) {
        return new IndexedPoi(poi.getId(), poi.getName(), poi.getLatitude(), poi.getLongitude(),
                poi.getCategory(), poi.getLastModified());
    }

    /**
     * Key along one of the three index dimensions
     */
    double key(int dimension) {
        return switch (dimension) {
            case LATITUDE -> latitude;
            case LONGITUDE -> longitude;
            case CATEGORY -> category.getCode();
            default -> throw new IllegalArgumentException("No such dimension: " + dimension);
        };
    }

    /**
     * Summary with its own position instance
     */
    public PoiSummary toSummary() {
        return PoiSummary.builder()
                .id(id)
                .name(name)
                .position(Position.of(latitude, longitude))
                .build();
    }
}
