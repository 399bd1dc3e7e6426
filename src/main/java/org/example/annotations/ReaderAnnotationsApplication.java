package org.example.annotations;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReaderAnnotationsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReaderAnnotationsApplication.class, args);
    }
}
