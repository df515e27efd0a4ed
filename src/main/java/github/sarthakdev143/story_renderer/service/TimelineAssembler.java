package github.sarthakdev143.story_renderer.service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface TimelineAssembler {

    Path assemble(
            List<Path> orderedClips,
            Path subtitleTrack,
            Path finalOutputPath,
            RenderCancellationToken cancellationToken) throws IOException, InterruptedException;
}
