package com.innstay.booking;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@OpenAPIDefinition(info = @Info(
        title = "Booking Service API",
        description = "Booking lifecycle, guest verification links, checkout and audit trail",
        version = "1.0.0"
))
@SpringBootApplication(scanBasePackages = {"com.innstay.booking", "com.innstay.common.exception"})
@EnableScheduling
public class BookingServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(BookingServiceApplication.class, args);
    }
}
