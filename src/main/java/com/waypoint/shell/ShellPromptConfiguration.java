package com.waypoint.shell;

import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStyle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.shell.jline.PromptProvider;

/**
 * Customizes the Spring Shell prompt.
 */
@Configuration(proxyBeanMethods = false)
public class ShellPromptConfiguration {

    static final String PROMPT_TEXT = "waypoint > ";

    /**
     * Renders the prompt as "{@code waypoint > }" in bright green.
     */
    @Bean
    public PromptProvider waypointPrompt() {
        return () -> new AttributedString(
                PROMPT_TEXT,
                AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.GREEN)
        );
    }
}
