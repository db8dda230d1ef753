package com.ospicorp.growthcurves;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GrowthCurvesApplication {

  public static void main(String[] args) {
    SpringApplication.run(GrowthCurvesApplication.class, args);
  }
}
