package com.poisearch.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HashMap;
import java.util.Map;

/**
 * Point of interest categories.
 * <p>
 * Codes are persisted, so a code is never reassigned: new categories take a new
 * code and retired ones leave a gap. Records written before a change stay valid.
 */
public enum Category {
    EV_CHARGING(0),
    LANDMARK(1),
    MUSEUM(2),
    RESTAURANT(3),
    SHOPPING(4);

    private static final Map<Integer, Category> BY_CODE = new HashMap<>();

    static {
        for (Category category : values()) {
            BY_CODE.put(category.code, category);
        }
    }

    private final int code;

    Category(int code) {
        this.code = code;
    }

    @JsonValue
    public int getCode() {
        return code;
    }

    /**
     * Resolve a persisted or wire code.
     *
     * @throws IllegalArgumentException if no category carries that code
     */
    @JsonCreator
    public static Category fromCode(int code) {
        Category category = BY_CODE.get(code);
        if (category == null) {
            throw new IllegalArgumentException("Unknown category code: " + code);
        }
        return category;
    }

    public static boolean isKnownCode(int code) {
        return BY_CODE.containsKey(code);
    }
}
