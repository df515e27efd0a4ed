package github.sarthakdev143.story_renderer.integration.video;

import github.sarthakdev143.story_renderer.exception.CompositionException;
import github.sarthakdev143.story_renderer.service.RenderCancellationToken;
import github.sarthakdev143.story_renderer.service.TimelineAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

@Component
public class FfmpegTimelineAssembler implements TimelineAssembler {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegTimelineAssembler.class);

    private final FfmpegCommandRunner commandRunner;

    public FfmpegTimelineAssembler(FfmpegCommandRunner commandRunner) {
        this.commandRunner = commandRunner;
    }

    @Override
    public Path assemble(
            List<Path> orderedClips,
            Path subtitleTrack,
            Path finalOutputPath,
            RenderCancellationToken cancellationToken) throws IOException, InterruptedException {
        if (orderedClips == null || orderedClips.isEmpty()) {
            throw new CompositionException("No scene clips were generated");
        }

        Path outputDir = finalOutputPath.toAbsolutePath().getParent();
        Files.createDirectories(outputDir);
        String stem = stripExtension(finalOutputPath.getFileName().toString());
        Path listFile = outputDir.resolve(stem + "_concat.txt");
        Path joined = outputDir.resolve(stem + "_joined.mp4");

        try {
            Files.writeString(listFile, buildConcatList(orderedClips), StandardCharsets.UTF_8);

            cancellationToken.throwIfStopRequested("before final assembly");
            commandRunner.run(buildConcatCommand(listFile, joined), "concatenate scenes");

            if (hasSubtitles(subtitleTrack)) {
                cancellationToken.throwIfStopRequested("before subtitle burn-in");
                commandRunner.run(buildBurnInCommand(joined, subtitleTrack, finalOutputPath), "burn subtitles");
            } else {
                Files.move(joined, finalOutputPath, StandardCopyOption.REPLACE_EXISTING);
            }
            return finalOutputPath;
        } finally {
            deleteIfExists(listFile);
            deleteIfExists(joined);
        }
    }

    String buildConcatList(List<Path> orderedClips) {
        StringBuilder list = new StringBuilder();
        for (Path clip : orderedClips) {
            String path = clip.toAbsolutePath().toString().replace('\\', '/').replace("'", "'\\''");
            list.append("file '").append(path).append("'\n");
        }
        return list.toString();
    }

    List<String> buildConcatCommand(Path listFile, Path outputPath) {
        return List.of(
                commandRunner.ffmpegBinary(),
                "-y",
                "-f",
                "concat",
                "-safe",
                "0",
                "-i",
                listFile.toString(),
                "-c",
                "copy",
                "-movflags",
                "+faststart",
                outputPath.toString());
    }

    List<String> buildBurnInCommand(Path videoPath, Path subtitlePath, Path outputPath) {
        return List.of(
                commandRunner.ffmpegBinary(),
                "-y",
                "-i",
                videoPath.toString(),
                "-vf",
                "subtitles=" + escapeFilterPath(subtitlePath),
                "-c:a",
                "copy",
                "-movflags",
                "+faststart",
                outputPath.toString());
    }

    private boolean hasSubtitles(Path subtitleTrack) throws IOException {
        return subtitleTrack != null && Files.isRegularFile(subtitleTrack) && Files.size(subtitleTrack) > 0;
    }

    private String escapeFilterPath(Path path) {
        return "'" + path.toAbsolutePath().toString()
                .replace('\\', '/')
                .replace(":", "\\:")
                .replace("'", "\\'") + "'";
    }

    private String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private void deleteIfExists(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not delete intermediate file {}", path, e);
        }
    }
}
