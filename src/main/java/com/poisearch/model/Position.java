package com.poisearch.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Latitude and longitude pair in decimal degrees.
 * Immutable, so copies handed to callers never alias index data.
 */
@Value
public class Position {

    public static final double MIN_LATITUDE = -90.0;
    public static final double MAX_LATITUDE = 90.0;
    public static final double MIN_LONGITUDE = -180.0;
    public static final double MAX_LONGITUDE = 180.0;

    double latitude;
    double longitude;

    @JsonCreator
    public Position(@JsonProperty("latitude") double latitude,
                    @JsonProperty("longitude") double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public static Position of(double latitude, double longitude) {
        return new Position(latitude, longitude);
    }

    /**
     * True when both coordinates fall inside their closed ranges
     */
    @JsonIgnore
    public boolean isWithinRange() {
        return isValidLatitude(latitude) && isValidLongitude(longitude);
    }

    public Position copy() {
        return new Position(latitude, longitude);
    }

    public static boolean isValidLatitude(double latitude) {
        return latitude >= MIN_LATITUDE && latitude <= MAX_LATITUDE;
    }

    public static boolean isValidLongitude(double longitude) {
        return longitude >= MIN_LONGITUDE && longitude <= MAX_LONGITUDE;
    }
}
