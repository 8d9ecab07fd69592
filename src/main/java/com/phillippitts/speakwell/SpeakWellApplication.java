package com.phillippitts.speakwell;

import com.phillippitts.speakwell.config.properties.AnalysisProperties;
import com.phillippitts.speakwell.config.properties.RubricProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        RubricProperties.class,
        AnalysisProperties.class
})
public class SpeakWellApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpeakWellApplication.class, args);
    }

}
