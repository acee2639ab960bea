package com.scholary.survey.translator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SurveyTranslatorApplication {

  public static void main(String[] args) {
    SpringApplication.run(SurveyTranslatorApplication.class, args);
  }
}
