package com.poisearch.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when client input is malformed or incomplete (HTTP 400).
 * <p>
 * Raised before any store interaction, so no mutation has happened when a caller sees it.
 * </p>
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class PoiValidationException extends PoiSearchException {

    public static final String POSITION_MISSING = "pmiss";
    public static final String POSITION_OUT_OF_RANGE = "badpos";
    public static final String CATEGORY_MISSING = "ctmiss";
    public static final String BAD_AREA = "badarea";
    public static final String BAD_PAYLOAD = "badpld";
    public static final String ID_MISSING = "idmiss";

    public PoiValidationException(String code, String message) {
        super(code, message);
    }

    public static PoiValidationException positionMissing() {
        return new PoiValidationException(POSITION_MISSING, "Position is missing.");
    }

    public static PoiValidationException positionOutOfRange() {
        return new PoiValidationException(POSITION_OUT_OF_RANGE,
                "Latitude must lie within [-90, 90] and longitude within [-180, 180].");
    }

    public static PoiValidationException categoryMissing() {
        return new PoiValidationException(CATEGORY_MISSING, "Category is missing.");
    }

    public static PoiValidationException idMissing() {
        return new PoiValidationException(ID_MISSING, "Identifier is missing.");
    }

    public static PoiValidationException badArea(String detail) {
        return new PoiValidationException(BAD_AREA, "Invalid search area: " + detail + ".");
    }
}
