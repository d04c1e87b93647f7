package com.acme.specguard.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class SchemaConfig {
  @Bean
  public SchemeHandlers schemeHandlers(ResourceLoader rl, ObjectMapper om) {
    return SchemeHandlers.defaults(rl, om);
  }
}
