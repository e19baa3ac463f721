package org.learningjava.facevec.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.learningjava.facevec")
public class FacevecApplication {
    public static void main(String[] args) {
        SpringApplication.run(FacevecApplication.class, args);
    }
}
