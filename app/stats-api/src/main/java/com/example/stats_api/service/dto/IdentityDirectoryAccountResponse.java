package com.example.stats_api.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IdentityDirectoryAccountResponse(String puuid, String gameName, String tagLine) {}
