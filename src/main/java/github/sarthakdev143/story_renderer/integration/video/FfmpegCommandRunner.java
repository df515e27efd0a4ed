package github.sarthakdev143.story_renderer.integration.video;

import github.sarthakdev143.story_renderer.exception.CompositionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs ffmpeg and ffprobe as child processes. Binaries come from {@code FFMPEG_PATH} and
 * {@code FFPROBE_PATH} when set, otherwise from the PATH.
 */
@Component
public class FfmpegCommandRunner {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegCommandRunner.class);
    static final String FFMPEG_PATH_ENV = "FFMPEG_PATH";
    static final String FFPROBE_PATH_ENV = "FFPROBE_PATH";
    private static final String DEFAULT_FFMPEG_BINARY = "ffmpeg";
    private static final String DEFAULT_FFPROBE_BINARY = "ffprobe";
    private static final long COMMAND_TIMEOUT_MINUTES = 10;

    public String ffmpegBinary() {
        return resolveBinary(FFMPEG_PATH_ENV, DEFAULT_FFMPEG_BINARY);
    }

    public String ffprobeBinary() {
        return resolveBinary(FFPROBE_PATH_ENV, DEFAULT_FFPROBE_BINARY);
    }

    /**
     * Runs {@code command} to completion. A non-zero exit raises {@link CompositionException} carrying the
     * combined tool output.
     */
    public String run(List<String> command, String stage) throws IOException, InterruptedException {
        logger.info("Running FFmpeg command for stage {}: {}", stage, String.join(" ", command));
        ProcessResult result = execute(command, stage);
        if (result.exitCode() != 0) {
            throw new CompositionException(stage, result.exitCode(), result.output().trim());
        }
        return result.output();
    }

    /**
     * Container duration in seconds, or empty when the file cannot be probed.
     */
    public Optional<Double> probeDuration(Path mediaPath) {
        List<String> command = List.of(
                ffprobeBinary(),
                "-v",
                "error",
                "-show_entries",
                "format=duration",
                "-of",
                "default=noprint_wrappers=1:nokey=1",
                mediaPath.toString());
        try {
            ProcessResult result = execute(command, "probe duration");
            if (result.exitCode() != 0) {
                logger.warn("ffprobe exited with {} for {}", result.exitCode(), mediaPath);
                return Optional.empty();
            }
            return parseDuration(result.output());
        } catch (IOException e) {
            logger.warn("ffprobe could not be run for {}", mediaPath, e);
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    static Optional<Double> parseDuration(String output) {
        if (output == null) {
            return Optional.empty();
        }
        String[] lines = output.trim().split("\\R");
        for (int index = lines.length - 1; index >= 0; index--) {
            String line = lines[index].trim();
            if (line.isEmpty()) {
                continue;
            }
            try {
                double value = Double.parseDouble(line);
                return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
            } catch (NumberFormatException ignored) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private ProcessResult execute(List<String> command, String stage) throws IOException, InterruptedException {
        Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .start();

        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append(System.lineSeparator());
            }
        }

        boolean finished = process.waitFor(COMMAND_TIMEOUT_MINUTES, TimeUnit.MINUTES);
        if (!finished) {
            process.destroyForcibly();
            throw new IOException("FFmpeg timed out during stage: " + stage);
        }
        return new ProcessResult(process.exitValue(), output.toString());
    }

    private static String resolveBinary(String envName, String defaultBinary) {
        String configured = System.getenv(envName);
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return defaultBinary;
    }

    private record ProcessResult(int exitCode, String output) {
    }
}
