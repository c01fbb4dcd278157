package com.pitchscope;

import com.pitchscope.config.properties.BatchProperties;
import com.pitchscope.config.properties.IntelligenceProperties;
import com.pitchscope.config.properties.ProviderProperties;
import com.pitchscope.config.properties.SessionProperties;
import com.pitchscope.config.properties.StreamingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ProviderProperties.class,
        StreamingProperties.class,
        BatchProperties.class,
        IntelligenceProperties.class,
        SessionProperties.class
})
@EnableScheduling
public class PitchScopeApplication {

    public static void main(String[] args) {
        SpringApplication.run(PitchScopeApplication.class, args);
    }

}
