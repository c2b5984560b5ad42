package it.piero.remoteforms.config;

import it.piero.remoteforms.service.implementation.LayoutParser;
import it.piero.remoteforms.service.implementation.field.TemporalFieldSerializer;
import it.piero.remoteforms.service.implementation.field.WidgetSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class RemoteFormsConfig {

    @Value("${remoteforms.date-input-formats}")
    private String[] dateInputFormats;

    @Value("${remoteforms.time-input-formats}")
    private String[] timeInputFormats;

    @Value("${remoteforms.datetime-input-formats}")
    private String[] dateTimeInputFormats;

    @Bean
    public TemporalFieldSerializer temporalFieldSerializer(WidgetSerializer widgetSerializer) {
        return new TemporalFieldSerializer(widgetSerializer,
                List.of(dateInputFormats),
                List.of(timeInputFormats),
                List.of(dateTimeInputFormats));
    }

    @Bean
    @ConditionalOnProperty(prefix = "remoteforms.layout", name = "enabled", havingValue = "true", matchIfMissing = true)
    public LayoutParser layoutParser() {
        return new LayoutParser();
    }
}
