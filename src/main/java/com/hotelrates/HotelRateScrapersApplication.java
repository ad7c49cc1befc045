package com.hotelrates;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application for the hotel rate scrapers service.
 */
@SpringBootApplication
public class HotelRateScrapersApplication {

    public static void main(String[] args) {
        SpringApplication.run(HotelRateScrapersApplication.class, args);
    }
}
