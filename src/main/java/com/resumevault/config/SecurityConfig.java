package com.resumevault.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resumevault.controller.ErrorResponse;
import com.resumevault.security.BearerTokenAuthenticationFilter;
import com.resumevault.security.PrincipalResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import java.time.Instant;

/**
 * Reads are public. Every other request needs a principal; ownership and admin checks happen in
 * the service layer.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    @Bean
    public SecurityFilterChain securityFilterChain(
        HttpSecurity http,
        PrincipalResolver principalResolver,
        ObjectMapper objectMapper
    ) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .httpBasic(basic -> basic.disable())
            .formLogin(form -> form.disable())
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.GET, "/resumes/**").permitAll()
                .requestMatchers("/error").permitAll()
                .anyRequest().authenticated()
            )
            .exceptionHandling(exceptions -> exceptions
                .authenticationEntryPoint((request, response, ex) -> {
                    response.setStatus(HttpStatus.UNAUTHORIZED.value());
                    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
                    objectMapper.writeValue(response.getOutputStream(), new ErrorResponse(
                        true,
                        "Authentication required.",
                        "UNAUTHORIZED",
                        null,
                        HttpStatus.UNAUTHORIZED.value(),
                        Instant.now().toEpochMilli()
                    ));
                })
            )
            .addFilterBefore(new BearerTokenAuthenticationFilter(principalResolver),
                UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }
}
