package io.doers.escrow.config;

import io.doers.escrow.model.AdminRole;
import io.doers.escrow.model.AdminRole.Permission;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.security.oauth2.resource.servlet.OAuth2ResourceServerAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationConverter;
import org.springframework.security.oauth2.server.resource.authentication.JwtGrantedAuthoritiesConverter;
import org.springframework.security.web.SecurityFilterChain;

/**
 * OAuth2 resource server chain. Only enabled when
 * spring.security.oauth2.resourceserver.jwt.issuer-uri is set (OAUTH2_ISSUER_URI).
 * Admin money operations are mapped to the roles holding the matching permission;
 * roles are read from the "roles" claim.
 */
@Configuration
@ConditionalOnProperty(
    prefix = "spring.security.oauth2.resourceserver.jwt",
    name = "issuer-uri"
)
@Import(OAuth2ResourceServerAutoConfiguration.class)
@EnableWebSecurity
public class SecurityConfig {

    @Bean("oauth2SecurityFilterChain")
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/health", "/actuator/info").permitAll()
                // gateway webhooks are verified by signature upstream
                .requestMatchers(HttpMethod.POST, "/api/payments/webhook").permitAll()
                .requestMatchers("/api/admin/payments/*/release-escrow")
                    .hasAnyRole(AdminRole.rolesWith(Permission.RELEASE_ESCROW))
                .requestMatchers("/api/admin/payments/*/refund", "/api/admin/contracts/*/cancel")
                    .hasAnyRole(AdminRole.rolesWith(Permission.REFUND))
                .requestMatchers("/api/admin/balance-transactions/**")
                    .hasAnyRole(AdminRole.rolesWith(Permission.CONFIRM_PAYOUT))
                .requestMatchers("/api/admin/payouts/**")
                    .hasAnyRole(AdminRole.rolesWith(Permission.VIEW_PAYOUTS))
                .requestMatchers("/api/admin/reconciliation/**")
                    .hasAnyRole(AdminRole.rolesWith(Permission.VIEW_RECONCILIATION))
                .requestMatchers("/api/escrow/dlq/**")
                    .hasAnyRole(AdminRole.rolesWith(Permission.MANAGE_DLQ))
                .anyRequest().authenticated()
            )
            .oauth2ResourceServer(oauth2 -> oauth2.jwt(Customizer.withDefaults()));

        return http.build();
    }

    @Bean
    public JwtAuthenticationConverter jwtAuthenticationConverter() {
        JwtGrantedAuthoritiesConverter authorities = new JwtGrantedAuthoritiesConverter();
        authorities.setAuthoritiesClaimName("roles");
        authorities.setAuthorityPrefix("ROLE_");
        JwtAuthenticationConverter converter = new JwtAuthenticationConverter();
        converter.setJwtGrantedAuthoritiesConverter(authorities);
        return converter;
    }
}
