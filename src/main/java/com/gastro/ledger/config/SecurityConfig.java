package com.gastro.ledger.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

    public static final String ROLE_STAFF = "STAFF";
    public static final String ROLE_MANAGER = "MANAGER";

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .sessionManagement(session -> session
                        .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/error").permitAll()

                        // Closing a day and changing the catalog are manager actions
                        .requestMatchers(HttpMethod.POST, "/api/days/*/close").hasRole(ROLE_MANAGER)
                        .requestMatchers(HttpMethod.GET, "/api/catalog/**").authenticated()
                        .requestMatchers("/api/catalog/**").hasRole(ROLE_MANAGER)

                        .anyRequest().authenticated())
                .httpBasic(Customizer.withDefaults());

        return http.build();
    }

    @Bean
    public UserDetailsService userDetailsService(PasswordEncoder encoder,
            @Value("${ledger.security.staff-username:staff}") String staffUsername,
            @Value("${ledger.security.staff-password}") String staffPassword,
            @Value("${ledger.security.manager-username:manager}") String managerUsername,
            @Value("${ledger.security.manager-password}") String managerPassword) {
        return new InMemoryUserDetailsManager(
                User.withUsername(staffUsername)
                        .password(encoder.encode(staffPassword))
                        .roles(ROLE_STAFF)
                        .build(),
                User.withUsername(managerUsername)
                        .password(encoder.encode(managerPassword))
                        .roles(ROLE_STAFF, ROLE_MANAGER)
                        .build());
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
