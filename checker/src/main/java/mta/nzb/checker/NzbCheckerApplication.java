package mta.nzb.checker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class NzbCheckerApplication {

    public static void main(String[] args) {
        SpringApplication.run(NzbCheckerApplication.class, args);
    }
}
