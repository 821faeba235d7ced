package io.doers.escrow.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Security chain used when no OAuth2 issuer is configured (local runs, tests).
 * Permits all requests.
 */
@Configuration
@EnableWebSecurity
public class DefaultSecurityConfig {

    @Bean("defaultSecurityFilterChain")
    @ConditionalOnMissingBean(name = "oauth2SecurityFilterChain")
    public SecurityFilterChain defaultSecurityFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .authorizeHttpRequests(auth -> auth
                .anyRequest().permitAll()
            );

        return http.build();
    }
}
