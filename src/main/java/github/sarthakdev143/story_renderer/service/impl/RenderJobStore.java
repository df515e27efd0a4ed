package github.sarthakdev143.story_renderer.service.impl;

import github.sarthakdev143.story_renderer.config.RenderProperties;
import github.sarthakdev143.story_renderer.integration.storage.RenderJobCodec;
import github.sarthakdev143.story_renderer.model.RenderJob;
import github.sarthakdev143.story_renderer.service.DurableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Job records as {@code renders/{jobId}.json} plus the project index at {@code renders/_project_index.json},
 * mirrored to the durable store when one is configured. Local files are the source of truth; the index is a
 * cache that can be rebuilt by {@link #scanForProject(String)}. Callers serialize access.
 */
@Component
public class RenderJobStore {

    private static final Logger logger = LoggerFactory.getLogger(RenderJobStore.class);
    static final String INDEX_FILE_NAME = "_project_index.json";
    private static final Pattern JOB_ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    private final Path renderDir;
    private final DurableStore durableStore;

    @Autowired
    public RenderJobStore(RenderProperties properties, DurableStore durableStore) {
        this(properties.renderDir(), durableStore);
    }

    RenderJobStore(Path renderDir, DurableStore durableStore) {
        this.renderDir = renderDir;
        this.durableStore = durableStore;
    }

    public void saveJob(RenderJob job, boolean mirrorRemote) {
        writeAtomically(jobPath(job.id()), RenderJobCodec.writeJob(job));
        if (mirrorRemote && durableStore.isEnabled()) {
            durableStore.putJob(job);
        }
    }

    public Optional<RenderJob> readLocalJob(String jobId) {
        if (!isValidJobId(jobId)) {
            return Optional.empty();
        }
        return readJobFile(jobPath(jobId))
                .filter(job -> jobId.equals(job.id()));
    }

    public Optional<RenderJob> readRemoteJob(String jobId) {
        if (!isValidJobId(jobId) || !durableStore.isEnabled()) {
            return Optional.empty();
        }
        return durableStore.getJob(jobId)
                .filter(job -> jobId.equals(job.id()));
    }

    /**
     * Local index merged with the remote one; remote entries win.
     */
    public Map<String, String> loadIndex() {
        Map<String, String> index = new LinkedHashMap<>();
        Path indexPath = renderDir.resolve(INDEX_FILE_NAME);
        if (Files.isRegularFile(indexPath)) {
            try {
                index.putAll(RenderJobCodec.readIndex(Files.readAllBytes(indexPath)));
            } catch (IOException | JacksonException e) {
                logger.warn("Ignoring unreadable project index {}", indexPath, e);
            }
        }
        if (durableStore.isEnabled()) {
            index.putAll(durableStore.getIndex());
        }
        return index;
    }

    public void saveIndex(Map<String, String> index) {
        Map<String, String> snapshot = new LinkedHashMap<>(index);
        writeAtomically(renderDir.resolve(INDEX_FILE_NAME), RenderJobCodec.writeIndex(snapshot));
        if (durableStore.isEnabled()) {
            durableStore.putIndex(snapshot);
        }
    }

    /**
     * Most recently written local job record that references {@code projectId}.
     */
    public Optional<RenderJob> scanForProject(String projectId) {
        if (!Files.isDirectory(renderDir)) {
            return Optional.empty();
        }

        RenderJob newest = null;
        FileTime newestTime = null;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(renderDir, "*.json")) {
            for (Path file : files) {
                if (file.getFileName().toString().startsWith("_")) {
                    continue;
                }
                Optional<RenderJob> job = readJobFile(file);
                if (job.isEmpty() || job.get().id() == null || !projectId.equals(job.get().projectId())) {
                    continue;
                }
                FileTime modified = Files.getLastModifiedTime(file);
                if (newestTime == null || modified.compareTo(newestTime) > 0) {
                    newest = job.get();
                    newestTime = modified;
                }
            }
        } catch (IOException e) {
            logger.warn("Scanning {} for project {} failed", renderDir, projectId, e);
        }
        return Optional.ofNullable(newest);
    }

    static boolean isValidJobId(String jobId) {
        return jobId != null && JOB_ID_PATTERN.matcher(jobId).matches();
    }

    Path jobPath(String jobId) {
        return renderDir.resolve(jobId + ".json");
    }

    private Optional<RenderJob> readJobFile(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(RenderJobCodec.readJob(Files.readAllBytes(file)));
        } catch (IOException | JacksonException e) {
            logger.warn("Ignoring unreadable job record {}", file, e);
            return Optional.empty();
        }
    }

    private void writeAtomically(Path target, byte[] content) {
        try {
            Files.createDirectories(renderDir);
            Path tempFile = Files.createTempFile(renderDir, ".write-", ".tmp");
            try {
                Files.write(tempFile, content);
                Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tempFile);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist " + target, e);
        }
    }
}
