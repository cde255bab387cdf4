package com.openforge.tutor;

import com.openforge.tutor.cache.CacheProperties;
import com.openforge.tutor.llm.LlmProperties;
import com.openforge.tutor.speech.SpeechProperties;
import com.openforge.tutor.teaching.TeachingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

// ConfigurationProperties records bound once for the whole context.
@SpringBootApplication
@EnableConfigurationProperties({
        LlmProperties.class,
        SpeechProperties.class,
        CacheProperties.class,
        TeachingProperties.class
})
public class TutorApplication {

    public static void main(String[] args) {
        SpringApplication.run(TutorApplication.class, args);
    }
}
