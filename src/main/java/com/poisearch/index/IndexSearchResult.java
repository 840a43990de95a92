package com.poisearch.index;

import lombok.Value;

import java.util.List;

/**
 * At most {@code limit} matches, plus whether strictly more than {@code limit} exist
 */
@Value
public class IndexSearchResult {

    List<IndexedPoi> matches;
    boolean truncated;
}
