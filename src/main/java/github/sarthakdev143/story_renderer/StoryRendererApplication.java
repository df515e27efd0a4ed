package github.sarthakdev143.story_renderer;

import github.sarthakdev143.story_renderer.config.RenderProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(RenderProperties.class)
public class StoryRendererApplication {

	public static void main(String[] args) {
		SpringApplication.run(StoryRendererApplication.class, args);
		System.out.println("					                                  \r\n" + //
				"  ___________ ________/  |_|  |__ _____  |  | __ __| _/_______  __\r\n" + //
				" /  ___/\\__  \\\\_  __ \\   __\\  |  \\\\__  \\ |  |/ // __ |/ __ \\  \\/ /\r\n" + //
				" \\___ \\  / __ \\|  | \\/|  | |   Y  \\/ __ \\|    </ /_/ \\  ___/\\   / \r\n" + //
				"/____  >(____  /__|   |__| |___|  (____  /__|_ \\____ |\\___  >\\_/  \r\n" + //
				"     \\/      \\/                 \\/     \\/     \\/    \\/    \\/      ");
	}

}
