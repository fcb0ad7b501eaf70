package io.doublezero.globalmonitor.infrastructure.exec;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 */
public final class ProcessCommandRunner implements CommandRunner {
  private static final int MAX_ERROR_CHARS = 512;

  @Override
  public String run(List<String> command, Duration timeout) throws IOException {
    CommandOutput output = exec(command, timeout);
    if (output.exitCode() != 0) {
      String err = output.stderr().trim();
      throw new IOException("Command exited with " + output.exitCode() + ": "
          + String.join(" ", command) + (err.isEmpty() ? "" : " (" + err + ")"));
    }
    return output.stdout();
  }

  @Override
  public CommandOutput exec(List<String> command, Duration timeout) throws IOException {
    ProcessBuilder pb = new ProcessBuilder(command);
    pb.redirectError(ProcessBuilder.Redirect.PIPE);
    Process process = pb.start();
    CompletableFuture<byte[]> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
    CompletableFuture<byte[]> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
    try {
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        throw new IOException("Command timed out after " + timeout + ": " + String.join(" ", command));
      }
      String out = new String(stdout.get(1, TimeUnit.SECONDS), StandardCharsets.UTF_8);
      String err = new String(stderr.get(1, TimeUnit.SECONDS), StandardCharsets.UTF_8);
      if (err.length() > MAX_ERROR_CHARS) {
        err = err.substring(0, MAX_ERROR_CHARS);
      }
      return new CommandOutput(process.exitValue(), out, err);
    } catch (InterruptedException ex) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while running " + String.join(" ", command));
    } catch (ExecutionException | TimeoutException ex) {
      throw new IOException("Failed to read output of " + String.join(" ", command), ex);
    }
  }

  private static byte[] drain(InputStream in) {
    try (in) {
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      in.transferTo(out);
      return out.toByteArray();
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }
}
