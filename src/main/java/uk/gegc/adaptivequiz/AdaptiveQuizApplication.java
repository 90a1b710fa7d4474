package uk.gegc.adaptivequiz;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AdaptiveQuizApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdaptiveQuizApplication.class, args);
    }
}
