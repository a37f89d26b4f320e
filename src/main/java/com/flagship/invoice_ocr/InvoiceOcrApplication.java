package com.flagship.invoice_ocr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InvoiceOcrApplication {

    public static void main(String[] args) {
        SpringApplication.run(InvoiceOcrApplication.class, args);
    }
}
