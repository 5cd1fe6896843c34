package uk.gegc.insightprep;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InsightPrepApplication {

    public static void main(String[] args) {
        SpringApplication.run(InsightPrepApplication.class, args);
    }
}
