package com.phillippitts.voicestream;

import com.phillippitts.voicestream.config.properties.EncoderProperties;
import com.phillippitts.voicestream.config.properties.EngineProperties;
import com.phillippitts.voicestream.config.properties.PoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        EngineProperties.class,
        PoolProperties.class,
        EncoderProperties.class
})
@EnableScheduling
public class VoiceStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceStreamApplication.class, args);
    }

}
