package com.poisearch.model.base;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Base entity with common fields using generics
 * Identity and modification time are both assigned by the store
 */
@Getter
@ToString
@EqualsAndHashCode
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class BaseEntity<ID> {
    
    /**
     * Unique identifier, immutable once assigned
     */
    private ID id;
    
    /**
     * Last save timestamp in epoch milliseconds
     */
    private long lastModified;
}
