package com.scholary.mdconverter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MdConverterApplication {

  public static void main(String[] args) {
    SpringApplication.run(MdConverterApplication.class, args);
  }
}
