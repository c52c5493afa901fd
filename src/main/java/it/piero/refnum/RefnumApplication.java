package it.piero.refnum;

import it.piero.refnum.config.CorrelationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(CorrelationProperties.class)
public class RefnumApplication {

    public static void main(String[] args) {
        SpringApplication.run(RefnumApplication.class, args);
        log.info("servizio refnum avviato");
    }
}
