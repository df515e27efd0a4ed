package github.sarthakdev143.story_renderer.service;

import java.nio.file.Path;

public interface MediaAcquirer {

    /**
     * Returns a local copy of {@code url}, downloading it only when no cached copy exists.
     */
    Path acquire(String url);
}
