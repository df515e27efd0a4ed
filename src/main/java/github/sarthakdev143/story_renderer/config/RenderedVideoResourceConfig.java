package github.sarthakdev143.story_renderer.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Serves locally rendered videos when no object storage is configured.
 */
@Configuration
public class RenderedVideoResourceConfig implements WebMvcConfigurer {

    private final RenderProperties properties;

    public RenderedVideoResourceConfig(RenderProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String prefix = properties.getPublicPathPrefix();
        String pattern = (prefix.endsWith("/") ? prefix : prefix + "/") + "**";
        String location = properties.renderDir().toAbsolutePath().toUri().toString();
        registry.addResourceHandler(pattern)
                .addResourceLocations(location.endsWith("/") ? location : location + "/");
    }
}
