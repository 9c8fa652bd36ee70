package com.example.pipelinesync.client.source;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * One page of a Source list or export endpoint.
 */
@Getter
@Builder
public class SourcePage {

    private final List<JsonNode> data;

    private final boolean hasMore;

    /** Export continuation token, present on export endpoints only. */
    private final String continueFrom;

    public boolean isEmpty() {
        return data == null || data.isEmpty();
    }
}
