package com.logo.playground.dto;

import java.util.List;

/**
 * Reserved words grouped the way the editor completes them.
 */
public record KeywordCatalog(
        List<String> commands,
        List<String> operators,
        List<String> constants) {
}
