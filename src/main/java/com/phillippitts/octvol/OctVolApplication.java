package com.phillippitts.octvol;

import com.phillippitts.octvol.config.properties.DecodeProperties;
import com.phillippitts.octvol.config.properties.RunnerProperties;
import com.phillippitts.octvol.config.properties.VolFormatProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        VolFormatProperties.class,
        DecodeProperties.class,
        RunnerProperties.class
})
public class OctVolApplication {

    public static void main(String[] args) {
        SpringApplication.run(OctVolApplication.class, args);
    }

}
