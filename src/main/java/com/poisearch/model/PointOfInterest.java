package com.poisearch.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.poisearch.exception.PoiValidationException;
import com.poisearch.model.base.BaseEntity;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A named, geolocated and categorized record.
 * Read-only once created; the only lifecycle change is removal.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class PointOfInterest extends BaseEntity<Long> {

    private final String name;
    private final Position position;
    private final Category category;

    @Builder
    public PointOfInterest(Long id, long lastModified, String name, Position position, Category category) {
        super(id, lastModified);
        if (position == null) {
            throw PoiValidationException.positionMissing();
        }
        if (category == null) {
            throw PoiValidationException.categoryMissing();
        }
        this.name = name != null ? name : "";
        this.position = position;
        this.category = category;
    }

    @JsonIgnore
    public double getLatitude() {
        return position.getLatitude();
    }

    @JsonIgnore
    public double getLongitude() {
        return position.getLongitude();
    }
}
