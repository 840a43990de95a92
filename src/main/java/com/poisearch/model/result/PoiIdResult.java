package com.poisearch.model.result;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identifier of a newly created point of interest
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PoiIdResult {

    private long id;
}
