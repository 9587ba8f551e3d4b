package org.kidoni.calculator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CalculatorApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CalculatorApplication.class, args)));
    }
}
