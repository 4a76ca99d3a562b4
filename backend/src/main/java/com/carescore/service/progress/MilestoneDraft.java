package com.carescore.service.progress;

public record MilestoneDraft(String description, double threshold) {}
