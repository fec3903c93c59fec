package com.easygo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.TimeZone;

@ConfigurationPropertiesScan
@SpringBootApplication
@EnableScheduling
public class StepboardApiApplication {

    public static void main(String[] args) {
        // 커넥션 풀이 열리기 전에 지정해야 LocalDate 바인딩이 어긋나지 않는다
        TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
        SpringApplication.run(StepboardApiApplication.class, args);
    }
}
