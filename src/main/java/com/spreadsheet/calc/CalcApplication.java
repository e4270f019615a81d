package com.spreadsheet.calc;

import com.spreadsheet.calc.config.CalculationProperties;
import com.spreadsheet.calc.config.ValidationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({CalculationProperties.class, ValidationProperties.class})
public class CalcApplication {

    public static void main(String[] args) {
        SpringApplication.run(CalcApplication.class, args);
    }
}
