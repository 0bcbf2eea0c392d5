package com.phillippitts.radflow.presentation.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Body of {@code POST /api/pick-lists/selection}: the item the user picked.
 */
public record PickListSelectionRequest(@NotBlank String list, @Min(0) int index) { }
