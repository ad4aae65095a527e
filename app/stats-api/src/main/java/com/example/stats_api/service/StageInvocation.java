package com.example.stats_api.service;

import com.example.stats_api.model.DispatchStage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** 外部ステージ 1 回の起動内容。command に positional arguments を後ろから連結して起動する。 */
public record StageInvocation(
    DispatchStage stage, List<String> command, List<String> arguments, Duration timeout) {

  public StageInvocation {
    command = List.copyOf(command);
    arguments = List.copyOf(arguments);
  }

  public List<String> commandLine() {
    final List<String> commandLine = new ArrayList<>(command.size() + arguments.size());
    commandLine.addAll(command);
    commandLine.addAll(arguments);
    return commandLine;
  }
}
