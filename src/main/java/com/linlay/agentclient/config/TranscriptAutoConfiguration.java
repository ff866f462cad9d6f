package com.linlay.agentclient.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentclient.stream.adapter.json.StreamFrameParser;
import com.linlay.agentclient.stream.service.TranscriptSessionFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import reactor.core.publisher.Flux;

@AutoConfiguration(after = JacksonAutoConfiguration.class)
@ConditionalOnClass({Flux.class, ObjectMapper.class})
@EnableConfigurationProperties(TranscriptProperties.class)
public class TranscriptAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper transcriptObjectMapper() {
        return new ObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public StreamFrameParser streamFrameParser(ObjectMapper objectMapper) {
        return new StreamFrameParser(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public TranscriptSessionFactory transcriptSessionFactory(ObjectMapper objectMapper, TranscriptProperties properties) {
        return new TranscriptSessionFactory(objectMapper, properties);
    }
}
