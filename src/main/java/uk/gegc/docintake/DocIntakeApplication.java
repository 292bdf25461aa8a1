package uk.gegc.docintake;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DocIntakeApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocIntakeApplication.class, args);
    }
}
