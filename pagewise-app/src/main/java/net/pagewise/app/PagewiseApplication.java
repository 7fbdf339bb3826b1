package net.pagewise.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PagewiseApplication {
    public static void main(String[] args) {
        SpringApplication.run(PagewiseApplication.class, args);
    }
}
