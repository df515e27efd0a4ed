package github.sarthakdev143.story_renderer.integration.video;

import github.sarthakdev143.story_renderer.exception.MissingAudioException;
import github.sarthakdev143.story_renderer.model.Orientation;
import github.sarthakdev143.story_renderer.service.SceneCompositor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Component
public class FfmpegSceneCompositor implements SceneCompositor {

    static final String BACKGROUND_COLOR = "0x141414";
    static final int FRAME_RATE = 30;
    private static final double MIN_DURATION_SECONDS = 0.1;
    private static final double EPSILON = 1e-9;

    private final FfmpegCommandRunner commandRunner;

    public FfmpegSceneCompositor(FfmpegCommandRunner commandRunner) {
        this.commandRunner = commandRunner;
    }

    @Override
    public Path buildSceneClip(
            Path mediaPath,
            Path audioPath,
            double durationSeconds,
            Orientation orientation,
            Path outputPath) throws IOException, InterruptedException {
        if (audioPath == null || !Files.isRegularFile(audioPath)) {
            throw new MissingAudioException(String.valueOf(outputPath.getFileName()), audioPath);
        }

        Orientation target = orientation == null ? Orientation.LANDSCAPE : orientation;
        if (outputPath.getParent() != null) {
            Files.createDirectories(outputPath.getParent());
        }

        List<String> command;
        if (mediaPath != null && Files.isRegularFile(mediaPath)) {
            Optional<Double> sourceDuration = commandRunner.probeDuration(mediaPath);
            command = buildMediaSceneCommand(
                    mediaPath, audioPath, durationSeconds, sourceDuration.orElse(null), target, outputPath);
        } else {
            command = buildColorSceneCommand(audioPath, durationSeconds, target, outputPath);
        }

        commandRunner.run(command, "render scene " + outputPath.getFileName());
        return outputPath;
    }

    List<String> buildMediaSceneCommand(
            Path mediaPath,
            Path audioPath,
            double durationSeconds,
            Double sourceDurationSeconds,
            Orientation orientation,
            Path outputPath) {
        double padSeconds = 0.0;
        if (sourceDurationSeconds != null && sourceDurationSeconds + EPSILON < durationSeconds) {
            padSeconds = durationSeconds - sourceDurationSeconds;
        }

        List<String> command = new ArrayList<>();
        command.add(commandRunner.ffmpegBinary());
        command.add("-y");
        command.add("-t");
        command.add(formatSeconds(clampDuration(durationSeconds)));
        command.add("-i");
        command.add(mediaPath.toString());
        command.add("-i");
        command.add(audioPath.toString());
        command.add("-vf");
        command.add(buildSceneFilter(orientation, padSeconds));
        command.add("-map");
        command.add("0:v:0");
        command.add("-map");
        command.add("1:a:0");
        addEncodeTail(command, outputPath);
        return command;
    }

    List<String> buildColorSceneCommand(
            Path audioPath,
            double durationSeconds,
            Orientation orientation,
            Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(commandRunner.ffmpegBinary());
        command.add("-y");
        command.add("-i");
        command.add(audioPath.toString());
        command.add("-f");
        command.add("lavfi");
        command.add("-i");
        command.add("color=c=" + BACKGROUND_COLOR
                + ":s=" + orientation.width() + "x" + orientation.height()
                + ":d=" + formatSeconds(clampDuration(durationSeconds)));
        command.add("-map");
        command.add("1:v:0");
        command.add("-map");
        command.add("0:a:0");
        command.add("-vf");
        command.add(buildSceneFilter(orientation, 0.0));
        addEncodeTail(command, outputPath);
        return command;
    }

    /**
     * Aspect-fill to the target frame; a positive pad freezes the last frame instead of looping.
     */
    String buildSceneFilter(Orientation orientation, double padSeconds) {
        int width = orientation.width();
        int height = orientation.height();
        String filter = "scale=" + width + ":" + height + ":force_original_aspect_ratio=increase,"
                + "crop=" + width + ":" + height;
        if (padSeconds > EPSILON) {
            filter = filter + ",tpad=stop_mode=clone:stop_duration=" + formatSeconds(padSeconds);
        }
        return filter;
    }

    private void addEncodeTail(List<String> command, Path outputPath) {
        command.add("-r");
        command.add(String.valueOf(FRAME_RATE));
        command.add("-c:v");
        command.add("libx264");
        command.add("-preset");
        command.add("veryfast");
        command.add("-crf");
        command.add("20");
        command.add("-pix_fmt");
        command.add("yuv420p");
        command.add("-c:a");
        command.add("aac");
        command.add("-ar");
        command.add("24000");
        command.add("-ac");
        command.add("1");
        // audio is the shorter stream whenever the video was padded, so it sets the clip length
        command.add("-shortest");
        command.add(outputPath.toString());
    }

    private double clampDuration(double durationSeconds) {
        return Math.max(durationSeconds, MIN_DURATION_SECONDS);
    }

    private String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.3f", seconds);
    }
}
