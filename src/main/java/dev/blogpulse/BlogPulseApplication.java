package dev.blogpulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BlogPulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlogPulseApplication.class, args);
    }
}
