package com.phillippitts.radflow.presentation.dto;

public record ProbeFailurePush(String reason) { }
