package com.poisearch.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Point-in-time statistics of a spatial index
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IndexStats {

    private String name;
    private String store;
    private boolean built;
    private boolean refreshing;
    private int size;
    private Long highWaterMark;
    private Long removalMark;
    private Instant lastRefreshed;
    private long refreshCount;
    private long failedRefreshCount;
}
