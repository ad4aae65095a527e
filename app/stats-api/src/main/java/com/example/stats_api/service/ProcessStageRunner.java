package com.example.stats_api.service;

import com.example.stats_api.config.DispatchProperties;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 外部ステージをローカルプロセスとして起動する {@link StageRunner}。
 *
 * <p>stdout/stderr は一時ファイルへ退避し、パイプ詰まりで子プロセスが止まらないようにする。失敗時は stderr の末尾を診断文字列として返す。
 */
@Component
public class ProcessStageRunner implements StageRunner {

  private static final Logger logger = LoggerFactory.getLogger(ProcessStageRunner.class);

  private final DispatchProperties properties;

  public ProcessStageRunner(DispatchProperties properties) {
    this.properties = properties;
  }

  @Override
  public StageOutcome run(StageInvocation invocation) {
    final String stage = invocation.stage().value();
    final List<String> commandLine = invocation.commandLine();
    final Path stdout;
    final Path stderr;
    try {
      stdout = Files.createTempFile("stats-" + stage + "-", ".out");
      stderr = Files.createTempFile("stats-" + stage + "-", ".err");
    } catch (IOException ex) {
      logger.warn("stage output capture could not be prepared stage={}", stage, ex);
      return StageOutcome.launchFailed(ex);
    }
    try {
      return runProcess(invocation, commandLine, stdout, stderr);
    } finally {
      deleteCapture(stdout);
      deleteCapture(stderr);
    }
  }

  private StageOutcome runProcess(
      StageInvocation invocation, List<String> commandLine, Path stdout, Path stderr) {
    final String stage = invocation.stage().value();
    final ProcessBuilder builder =
        new ProcessBuilder(commandLine)
            .redirectOutput(stdout.toFile())
            .redirectError(stderr.toFile());
    if (properties.workingDirectory() != null) {
      builder.directory(new File(properties.workingDirectory()));
    }
    final long startedAt = System.nanoTime();
    final Process process;
    try {
      process = builder.start();
    } catch (IOException ex) {
      logger.warn("stage launch failed stage={} command={}", stage, invocation.command(), ex);
      return StageOutcome.launchFailed(ex);
    }
    final boolean finished;
    try {
      finished = process.waitFor(invocation.timeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      // 子プロセスは止めない。取り込みと集計の組を途中で壊さないため。
      Thread.currentThread().interrupt();
      logger.warn("stage wait interrupted stage={} pid={}", stage, process.pid());
      return StageOutcome.interrupted();
    }
    final long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
    if (!finished) {
      logger.warn(
          "stage timed out stage={} timeoutMs={}", stage, invocation.timeout().toMillis());
      terminate(process, stage);
      return StageOutcome.timedOut(
          withFallback(readDiagnostic(stderr), "timed out after " + invocation.timeout()));
    }
    final int exitStatus = process.exitValue();
    if (exitStatus == 0) {
      logger.info("stage finished stage={} elapsedMs={}", stage, elapsedMillis);
      return StageOutcome.succeeded();
    }
    final String diagnostic =
        withFallback(readDiagnostic(stderr), "exited with status " + exitStatus);
    logger.warn(
        "stage failed stage={} exitStatus={} elapsedMs={}", stage, exitStatus, elapsedMillis);
    return StageOutcome.failed(exitStatus, diagnostic);
  }

  // リトライ時に同じキーの次の試行と重ならないよう、終了を確認してから戻る。
  private void terminate(Process process, String stage) {
    process.destroyForcibly();
    try {
      if (!process.waitFor(
          DispatchProperties.STAGE_TERMINATION_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.warn("stage process did not exit after kill stage={} pid={}", stage, process.pid());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.warn("stage termination wait interrupted stage={} pid={}", stage, process.pid());
    }
  }

  private String readDiagnostic(Path stderr) {
    final String text;
    try {
      text = new String(Files.readAllBytes(stderr), StandardCharsets.UTF_8).trim();
    } catch (IOException ex) {
      logger.warn("stage diagnostic could not be read path={}", stderr, ex);
      return "";
    }
    final int maxLength = properties.diagnosticMaxLength();
    // traceback は末尾に原因が出るため、切り詰めは先頭側を落とす。
    return text.length() <= maxLength ? text : text.substring(text.length() - maxLength);
  }

  private String withFallback(String diagnostic, String fallback) {
    return diagnostic.isEmpty() ? fallback : diagnostic;
  }

  private void deleteCapture(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException ex) {
      logger.debug("stage capture file could not be deleted path={}", path, ex);
    }
  }
}
