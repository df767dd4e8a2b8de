package com.gt.lrs.conf;

import com.gt.lrs.filter.UpstreamAuthFilter;
import jakarta.servlet.DispatcherType;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.logout.LogoutFilter;

/**
 * Users are authenticated by the gateway in front of this service, which forwards the user id in a header. The
 * maintenance endpoints are for other services only and require the shared API key instead.
 */
@Configuration
@EnableWebSecurity
public class WebSecurityConfig {

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http, UpstreamAuthFilter upstreamAuthFilter) throws Exception {
        http.cors(Customizer.withDefaults())
                .csrf(AbstractHttpConfigurer::disable)
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests((requests) -> requests
                        .dispatcherTypeMatchers(DispatcherType.FORWARD, DispatcherType.ERROR).permitAll()
                        .requestMatchers("/rest/maintenance/**").hasRole(UpstreamAuthFilter.SERVICE_ROLE)
                        .requestMatchers("/rest/**").hasRole(UpstreamAuthFilter.USER_ROLE)
                        .anyRequest().denyAll())
                .addFilterAfter(upstreamAuthFilter, LogoutFilter.class);

        return http.build();
    }
}
