package com.williamcallahan.docarchive.config;

import com.williamcallahan.docarchive.support.EnvironmentVariableSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EnvironmentConfig {

    @Bean
    public EnvironmentVariableSource environmentVariableSource() {
        return EnvironmentVariableSource.system();
    }
}
