package com.poisearch.model.param;

import com.poisearch.model.Category;
import com.poisearch.model.Position;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of poi_create. Position and category are optional on the wire so that
 * their absence can be reported as a validation error rather than a parse error.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatePoiParam {

    private String name;
    private Position position;
    private Category category;

    public boolean hasPosition() {
        return position != null;
    }
}
