package io.b2mash.jasper.mcpserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class JasperMcpServerApplication {

  public static void main(String[] args) {
    SpringApplication.run(JasperMcpServerApplication.class, args);
  }
}
