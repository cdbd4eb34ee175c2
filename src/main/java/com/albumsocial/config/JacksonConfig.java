package com.albumsocial.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * HTTP 输出约定：id 字段输出字符串；null 字段省略（匿名化记录不输出 userId）。
 */
@Configuration
public class JacksonConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer albumSocialJacksonCustomizer() {
        return builder -> {
            IdLongJsonSerializer idSerializer = new IdLongJsonSerializer();
            builder.serializerByType(Long.class, idSerializer);
            builder.serializerByType(Long.TYPE, idSerializer);
            builder.serializationInclusion(JsonInclude.Include.NON_NULL);
        };
    }
}
