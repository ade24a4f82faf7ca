package org.example.dailyreport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DailyReportApplication {

    public static void main(String[] args) {
        SpringApplication.run(DailyReportApplication.class, args);
    }
}
