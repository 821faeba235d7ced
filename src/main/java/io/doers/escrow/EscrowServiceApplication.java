package io.doers.escrow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.oauth2.resource.servlet.OAuth2ResourceServerAutoConfiguration;
import org.springframework.retry.annotation.EnableRetry;

@SpringBootApplication(exclude = {
    OAuth2ResourceServerAutoConfiguration.class  // enabled through SecurityConfig when an issuer is set
})
@EnableRetry
public class EscrowServiceApplication {
  public static void main(String[] args) {
    SpringApplication.run(EscrowServiceApplication.class, args);
  }
}
