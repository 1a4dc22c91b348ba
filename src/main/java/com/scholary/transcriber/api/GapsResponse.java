package com.scholary.transcriber.api;

import java.util.List;

/** Missing sequence indices of a session, ascending. */
public record GapsResponse(String sessionId, List<Integer> missingIndices, boolean hasGaps) {}
