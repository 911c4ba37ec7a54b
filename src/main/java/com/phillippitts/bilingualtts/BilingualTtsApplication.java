package com.phillippitts.bilingualtts;

import com.phillippitts.bilingualtts.config.properties.PipelineProperties;
import com.phillippitts.bilingualtts.config.properties.SegmentationProperties;
import com.phillippitts.bilingualtts.config.properties.ThreadPoolProperties;
import com.phillippitts.bilingualtts.config.properties.VoiceProperties;
import com.phillippitts.bilingualtts.config.properties.WorkspaceProperties;
import com.phillippitts.bilingualtts.config.synthesis.EdgeTtsConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        EdgeTtsConfig.class,
        SegmentationProperties.class,
        PipelineProperties.class,
        VoiceProperties.class,
        WorkspaceProperties.class,
        ThreadPoolProperties.class
})
public class BilingualTtsApplication {

    public static void main(String[] args) {
        SpringApplication.run(BilingualTtsApplication.class, args);
    }

}
