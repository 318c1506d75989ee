package com.example.tagging;

import com.example.tagging.config.TaggingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(TaggingProperties.class)
public class EventTaggerApplication {

	public static void main(String[] args) {
		SpringApplication.run(EventTaggerApplication.class, args);
	}

}
