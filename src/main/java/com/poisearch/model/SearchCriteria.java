package com.poisearch.model;

import com.poisearch.exception.PoiValidationException;
import lombok.Getter;
import lombok.ToString;
import org.locationtech.jts.geom.Envelope;

/**
 * Rectangular area plus a single category.
 * Longitude maps to x and latitude to y, as everywhere JTS envelopes are used.
 */
@Getter
@ToString
public class SearchCriteria {

    private final Interval latitude;
    private final Interval longitude;
    private final Category category;

    public SearchCriteria(Interval latitude, Interval longitude, Category category) {
        if (latitude == null || longitude == null || !latitude.isWellFormed() || !longitude.isWellFormed()) {
            throw PoiValidationException.badArea("Intervals must satisfy min <= max");
        }
        if (!Position.isValidLatitude(latitude.getMin()) || !Position.isValidLatitude(latitude.getMax())) {
            throw PoiValidationException.badArea("Latitude must lie within [-90, 90]");
        }
        if (!Position.isValidLongitude(longitude.getMin()) || !Position.isValidLongitude(longitude.getMax())) {
            throw PoiValidationException.badArea("Longitude must lie within [-180, 180]");
        }
        if (category == null) {
            throw PoiValidationException.categoryMissing();
        }
        this.latitude = latitude;
        this.longitude = longitude;
        this.category = category;
    }

    public static SearchCriteria of(double latitudeMin, double latitudeMax,
                                    double longitudeMin, double longitudeMax,
                                    Category category) {
        return new SearchCriteria(Interval.of(latitudeMin, latitudeMax),
                Interval.of(longitudeMin, longitudeMax), category);
    }

    public Envelope toEnvelope() {
        return new Envelope(longitude.getMin(), longitude.getMax(), latitude.getMin(), latitude.getMax());
    }

    public boolean matches(double lat, double lon, Category candidate) {
        return category == candidate && latitude.contains(lat) && longitude.contains(lon);
    }
}
