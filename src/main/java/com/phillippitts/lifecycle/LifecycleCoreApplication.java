package com.phillippitts.lifecycle;

import com.phillippitts.lifecycle.config.properties.ErrorRecoveryProperties;
import com.phillippitts.lifecycle.config.properties.StatusCoordinatorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        StatusCoordinatorProperties.class,
        ErrorRecoveryProperties.class
})
public class LifecycleCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(LifecycleCoreApplication.class, args);
    }

}
