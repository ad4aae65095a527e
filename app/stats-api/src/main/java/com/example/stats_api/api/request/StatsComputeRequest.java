/*
 * どこで: Stats API リクエスト DTO
 * 何を: 統計計算 API の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.example.stats_api.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StatsComputeRequest(
    @NotBlank String handle, @NotBlank String region, @NotBlank String period, @Positive Integer limit) {}
