package com.phillippitts.radflow.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record ClassificationPush(@NotBlank String accession, String priority, String classification) { }
