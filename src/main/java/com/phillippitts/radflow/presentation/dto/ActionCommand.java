package com.phillippitts.radflow.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of {@code POST /api/actions}.
 *
 * @param action action kind name, e.g. {@code PROCESS_REPORT}
 * @param source optional source label; defaults to {@code Api}
 */
public record ActionCommand(@NotBlank String action, String source) { }
