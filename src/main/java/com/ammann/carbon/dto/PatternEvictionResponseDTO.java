/* (C)2026 */
package com.ammann.carbon.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Result of a cache eviction")
public record PatternEvictionResponseDTO(
        @Schema(description = "Number of evicted patterns") int evicted,
        @Schema(description = "Regions still cached after the eviction") List<String> remainingRegions) {}
