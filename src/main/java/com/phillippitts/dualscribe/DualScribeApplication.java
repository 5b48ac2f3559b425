package com.phillippitts.dualscribe;

import com.phillippitts.dualscribe.config.properties.AudioCaptureProperties;
import com.phillippitts.dualscribe.config.properties.RecognitionProperties;
import com.phillippitts.dualscribe.config.properties.RecordingProperties;
import com.phillippitts.dualscribe.config.properties.TranscriptProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        AudioCaptureProperties.class,
        RecognitionProperties.class,
        TranscriptProperties.class,
        RecordingProperties.class
})
@EnableScheduling
public class DualScribeApplication {

    public static void main(String[] args) {
        SpringApplication.run(DualScribeApplication.class, args);
    }

}
