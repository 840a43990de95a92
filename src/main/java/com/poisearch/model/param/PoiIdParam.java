package com.poisearch.model.param;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload carrying a single document identifier
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PoiIdParam {

    private Long id;
}
