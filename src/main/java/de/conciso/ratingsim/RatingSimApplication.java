package de.conciso.ratingsim;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RatingSimApplication {

    public static void main(String[] args) {
        SpringApplication.run(RatingSimApplication.class, args);
    }
}
