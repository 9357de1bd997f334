package org.learningjava.assessrec.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.learningjava.assessrec")
public class AssessrecApplication {
    public static void main(String[] args) {
        SpringApplication.run(AssessrecApplication.class, args);
    }
}
