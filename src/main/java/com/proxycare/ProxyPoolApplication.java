package com.proxycare;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProxyPoolApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProxyPoolApplication.class, args);
    }
}
