package com.example.Microgrid_Dispatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MicrogridDispatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(MicrogridDispatchApplication.class, args);
    }
}
