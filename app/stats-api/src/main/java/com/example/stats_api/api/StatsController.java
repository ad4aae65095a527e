/*
 * どこで: Stats API
 * 何を: 統計計算と保存済み統計参照のエンドポイントを公開する
 * なぜ: 表示層からの要求を受け付ける入口を提供するため
 */
package com.example.stats_api.api;

import com.example.stats_api.api.request.StatsComputeRequest;
import com.example.stats_api.api.response.StatsResponse;
import com.example.stats_api.service.StatsPipelineService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class StatsController {

  private final StatsPipelineService statsPipelineService;

  /**
   * 役割:
   * - handle/region/period をもとに外部計算を起動し、計算済みドキュメントを返す。
   *
   * 期待動作:
   * - 計算は毎回起動する。同一キーの同時要求は 1 回の計算結果を共有する。
   */
  @PostMapping("/stats")
  public ResponseEntity<StatsResponse> computeStats(
      @Valid @RequestBody StatsComputeRequest request) {
    return ResponseEntity.ok(
        StatsResponse.from(
            statsPipelineService.compute(
                request.handle(), request.region(), request.period(), request.limit())));
  }

  @GetMapping("/players/{identifier}/stats/{period}")
  public ResponseEntity<StatsResponse> getStoredStats(
      @PathVariable("identifier") String identifier, @PathVariable("period") String period) {
    return ResponseEntity.ok(
        StatsResponse.from(statsPipelineService.findStored(identifier, period)));
  }
}
