package com.adlanda.codecontext.model;

import java.util.List;

/**
 * Response of a semantic search.
 *
 * @param query    The original query
 * @param results  Matches ordered by descending similarity
 */
public record SearchResponse(String query, List<MatchResult> results) {}
