package ru.javaboys.huntymatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import ru.javaboys.huntymatch.config.MatchProperties;

@SpringBootApplication
@EnableConfigurationProperties(MatchProperties.class)
public class HuntyMatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(HuntyMatchApplication.class, args);
    }
}
