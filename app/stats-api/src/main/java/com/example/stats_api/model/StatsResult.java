package com.example.stats_api.model;

public record StatsResult(PlayerIdentifier identifier, Period period, ResultDocument document) {}
