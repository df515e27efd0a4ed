package github.sarthakdev143.story_renderer.integration.storage;

import github.sarthakdev143.story_renderer.model.RenderJob;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.json.JsonMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON shape of persisted job records and the project index, shared by the local and remote stores.
 */
public final class RenderJobCodec {

    private static final JsonMapper MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    private static final TypeReference<LinkedHashMap<String, String>> INDEX_TYPE = new TypeReference<>() {
    };

    private RenderJobCodec() {
    }

    public static byte[] writeJob(RenderJob job) {
        return MAPPER.writeValueAsBytes(job);
    }

    public static RenderJob readJob(byte[] content) throws JacksonException {
        return MAPPER.readValue(content, RenderJob.class);
    }

    public static byte[] writeIndex(Map<String, String> index) {
        return MAPPER.writeValueAsBytes(index);
    }

    public static Map<String, String> readIndex(byte[] content) throws JacksonException {
        LinkedHashMap<String, String> index = MAPPER.readValue(content, INDEX_TYPE);
        if (index == null) {
            return new LinkedHashMap<>();
        }
        index.entrySet().removeIf(entry -> entry.getKey() == null || entry.getValue() == null);
        return index;
    }
}
