package uk.gegc.examgen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExamGeneratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExamGeneratorApplication.class, args);
    }
}
