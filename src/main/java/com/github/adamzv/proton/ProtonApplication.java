package com.github.adamzv.proton;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProtonApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(ProtonApplication.class, args)));
  }
}
