package com.catalog.crawler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CatalogCrawlerApplication {
    public static void main(String[] args) {
        SpringApplication.run(CatalogCrawlerApplication.class, args);
    }
}
