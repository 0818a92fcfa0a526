package org.evalux.landlord;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LandlordScorerApplication {
    public static void main(String[] args) {
        SpringApplication.run(LandlordScorerApplication.class, args);
    }
}
