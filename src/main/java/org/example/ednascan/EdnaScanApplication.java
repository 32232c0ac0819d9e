package org.example.ednascan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class EdnaScanApplication {
    public static void main(String[] args) {
        SpringApplication.run(EdnaScanApplication.class, args);
    }
}
