package com.example.harborwatch;

import com.example.harborwatch.config.HarborWatchProperties;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@OpenAPIDefinition(
        info = @Info(
                title = "Harbor Watch API",
                version = "1.0",
                description = "REST API for correlating satellite ship detections with the vessel registry and flagging dark ships.",
                contact = @Contact(name = "Harbor Watch")))
@SpringBootApplication
@EnableConfigurationProperties(HarborWatchProperties.class)
public class HarborWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(HarborWatchApplication.class, args);
    }
}
