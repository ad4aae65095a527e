package com.example.stats_api;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@SpringBootApplication
@Import(TimeConfig.class)
@RestController
public class StatsApiApplication {

  public static void main(String[] args) {
    SpringApplication.run(StatsApiApplication.class, args);
  }

  @GetMapping("/")
  public String home() {
    return "stats-api: ok";
  }
}
