package github.sarthakdev143.story_renderer.integration.narration;

import github.sarthakdev143.story_renderer.config.RenderProperties;
import github.sarthakdev143.story_renderer.model.NarrationAudio;
import github.sarthakdev143.story_renderer.service.NarrationSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stand-in speech engine that writes silent WAV narration sized to the text's word count. Output is
 * cached by voice and text so a re-render reuses the same file.
 */
@Component
public class PlaceholderNarrationSynthesizer implements NarrationSynthesizer {

    private static final Logger logger = LoggerFactory.getLogger(PlaceholderNarrationSynthesizer.class);
    static final float SAMPLE_RATE = 48_000f;
    static final double MIN_DURATION_SECONDS = 2.0;
    static final double WORDS_PER_SECOND = 2.5;
    private static final int SAMPLE_SIZE_BITS = 16;
    private static final int CHANNELS = 1;

    private final Path cacheDir;

    @Autowired
    public PlaceholderNarrationSynthesizer(RenderProperties properties) {
        this(properties.audioCacheDir());
    }

    PlaceholderNarrationSynthesizer(Path cacheDir) {
        this.cacheDir = cacheDir;
    }

    @Override
    public NarrationAudio synthesizeNarration(String text, String voice) throws IOException {
        String narration = text == null ? "" : text.trim();
        Path target = cacheDir.resolve(cacheKey(voice, narration) + ".wav");
        if (!Files.isRegularFile(target)) {
            Files.createDirectories(cacheDir);
            writeSilence(target, estimateDuration(narration));
            logger.info("Wrote placeholder narration voice={} path={}", voice, target);
        }
        return new NarrationAudio(target, readDuration(target));
    }

    static double estimateDuration(String text) {
        int words = text == null || text.isBlank() ? 0 : text.trim().split("\\s+").length;
        return Math.max(MIN_DURATION_SECONDS, words / WORDS_PER_SECOND);
    }

    static String cacheKey(String voice, String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((voice + "::" + text).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private void writeSilence(Path target, double durationSeconds) throws IOException {
        AudioFormat format = new AudioFormat(SAMPLE_RATE, SAMPLE_SIZE_BITS, CHANNELS, true, false);
        long frames = Math.round(durationSeconds * SAMPLE_RATE);
        byte[] samples = new byte[Math.toIntExact(frames * format.getFrameSize())];

        Path tempFile = Files.createTempFile(cacheDir, "narration-", ".part");
        try (AudioInputStream stream = new AudioInputStream(new ByteArrayInputStream(samples), format, frames)) {
            AudioSystem.write(stream, AudioFileFormat.Type.WAVE, tempFile.toFile());
            Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tempFile);
        }
    }

    private double readDuration(Path wav) throws IOException {
        try {
            AudioFileFormat fileFormat = AudioSystem.getAudioFileFormat(wav.toFile());
            return fileFormat.getFrameLength() / (double) fileFormat.getFormat().getFrameRate();
        } catch (UnsupportedAudioFileException e) {
            throw new IOException("Narration file is not a readable WAV: " + wav, e);
        }
    }
}
