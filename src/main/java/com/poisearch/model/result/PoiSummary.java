package com.poisearch.model.result;

import com.poisearch.model.Position;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Search hit. The category is part of the criteria, so it is not repeated here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoiSummary {

    private long id;
    private String name;
    private Position position;
}
