package com.phillippitts.radflow.presentation.dto;

/**
 * A single boolean reading pushed by the scraper.
 */
public record FlagPush(boolean value) { }
