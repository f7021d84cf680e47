package com.talentpilot.tracker.config;

import com.talentpilot.tracker.model.ContactChannel;
import com.talentpilot.tracker.model.OutreachState;
import com.talentpilot.tracker.model.PipelineStage;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Lets query parameters use the same snake_case values as JSON bodies,
 * e.g. {@code ?status=no_response}.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, OutreachState.class, OutreachState::fromWire);
        registry.addConverter(String.class, ContactChannel.class, ContactChannel::fromWire);
        registry.addConverter(String.class, PipelineStage.class, PipelineStage::fromWire);
    }
}
