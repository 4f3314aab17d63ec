package com.timeBank.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.timeBank.exception.ErrorBody;
import com.timeBank.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.Arrays;
import java.util.List;

@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

        static final String PUBLIC_TASK_LISTING = "/api/tasks";

        private final BearerTokenFilter bearerTokenFilter;
        private final ObjectMapper objectMapper;

        /**
         * Read from application.yml, override with env CORS_ORIGINS on deploy
         */
        @Value("${cors.allowed-origins}")
        private List<String> allowedOrigins;

        @Bean
        public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
                http
                                .csrf(csrf -> csrf.disable())
                                .cors(cors -> cors.configurationSource(corsConfigurationSource()))
                                .sessionManagement(session -> session
                                                .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                                .authorizeHttpRequests(auth -> auth
                                                // Public, no token required
                                                .requestMatchers("/api/health").permitAll()
                                                .requestMatchers(HttpMethod.GET, PUBLIC_TASK_LISTING).permitAll()
                                                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()

                                                // Everything else requires a Firebase Bearer Token
                                                .anyRequest().authenticated())
                                .exceptionHandling(exceptions -> exceptions
                                                .authenticationEntryPoint(unauthenticatedEntryPoint()))
                                .addFilterBefore(bearerTokenFilter, UsernamePasswordAuthenticationFilter.class);

                return http.build();
        }

        /** Runs inside the security chain only, not a second time as a plain servlet filter */
        @Bean
        public FilterRegistrationBean<BearerTokenFilter> bearerTokenFilterRegistration(BearerTokenFilter filter) {
                FilterRegistrationBean<BearerTokenFilter> registration = new FilterRegistrationBean<>(filter);
                registration.setEnabled(false);
                return registration;
        }

        @Bean
        public CorsConfigurationSource corsConfigurationSource() {
                CorsConfiguration configuration = new CorsConfiguration();

                boolean hasWildcard = allowedOrigins != null
                                && allowedOrigins.stream().anyMatch("*"::equals);

                if (hasWildcard) {
                        configuration.setAllowedOriginPatterns(List.of("*"));
                } else {
                        configuration.setAllowedOrigins(allowedOrigins);
                }
                configuration.setAllowedMethods(Arrays.asList("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS"));
                configuration.setAllowedHeaders(Arrays.asList("Authorization", "Content-Type", "Cache-Control"));
                configuration.setAllowCredentials(!hasWildcard);

                UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
                source.registerCorsConfiguration("/**", configuration);
                return source;
        }

        private AuthenticationEntryPoint unauthenticatedEntryPoint() {
                return (request, response, authException) -> {
                        ErrorCode code = ErrorCode.UNAUTHENTICATED;
                        response.setStatus(code.getStatus().value());
                        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
                        response.setCharacterEncoding("UTF-8");
                        objectMapper.writeValue(response.getWriter(),
                                        ErrorBody.of(code.getStatus(), code.name(), "Not authenticated"));
                };
        }
}
