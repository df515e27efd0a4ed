package github.sarthakdev143.story_renderer.config;

import github.sarthakdev143.story_renderer.integration.video.FfmpegCommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(name = "render.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);
    private static final int TOOL_CHECK_TIMEOUT_SECONDS = 10;

    private final FfmpegCommandRunner commandRunner;
    private final RenderProperties properties;

    public StartupPreflightChecks(FfmpegCommandRunner commandRunner, RenderProperties properties) {
        this.commandRunner = commandRunner;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkTool(commandRunner.ffmpegBinary(), "FFmpeg", "FFMPEG_PATH");
        checkTool(commandRunner.ffprobeBinary(), "FFprobe", "FFPROBE_PATH");
        checkOutputDirectories();
    }

    private void checkTool(String binary, String toolName, String envName) {
        try {
            Process process = new ProcessBuilder(binary, "-version")
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            boolean finished = process.waitFor(TOOL_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished || process.exitValue() != 0) {
                if (!finished) {
                    process.destroyForcibly();
                }
                throw new IllegalStateException(
                        toolName + " is not runnable at '" + binary + "'. Install it or set " + envName + ".");
            }
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException(
                    toolName + " is not runnable at '" + binary + "'. Install it or set " + envName + ".",
                    e);
        }
    }

    private void checkOutputDirectories() {
        Path[] directories = {
                properties.renderDir(),
                properties.audioCacheDir(),
                properties.videoCacheDir(),
                properties.subtitleCacheDir()
        };
        for (Path directory : directories) {
            try {
                Files.createDirectories(directory);
            } catch (IOException e) {
                throw new IllegalStateException("Output directory is not writable: " + directory.toAbsolutePath(), e);
            }
            if (!Files.isWritable(directory)) {
                throw new IllegalStateException("Output directory is not writable: " + directory.toAbsolutePath());
            }
        }
        logger.info("Render output directory ready at {}", properties.getOutputDir().toAbsolutePath());
    }
}
