package uk.gegc.antidote;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AntidoteBillingApplication {

    public static void main(String[] args) {
        SpringApplication.run(AntidoteBillingApplication.class, args);
    }
}
