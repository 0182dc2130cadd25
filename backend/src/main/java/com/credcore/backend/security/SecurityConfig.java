package com.credcore.backend.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

import lombok.RequiredArgsConstructor;

/**
 * Spring Security 전역 보안 설정
 *
 * - 이 서비스가 여는 API는 가입/확인 세 개뿐이고 모두 인증 전 단계라 permitAll이다.
 * - 그 외 경로는 전부 막고, EntryPoint가 401 ApiError(AUTH_REQUIRED)를 내려준다.
 * - 세션/쿠키를 쓰지 않으므로 CSRF, formLogin, httpBasic 모두 끈다.
 */
@Configuration
@RequiredArgsConstructor
public class SecurityConfig {

    private final RestAuthEntryPoint restAuthEntryPoint;

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        return http
                .csrf(csrf -> csrf.disable())
                .httpBasic(b -> b.disable())
                .formLogin(f -> f.disable())
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .exceptionHandling(eh -> eh.authenticationEntryPoint(restAuthEntryPoint))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/error").permitAll()

                        // K8s Liveness/Readiness Probe
                        .requestMatchers("/actuator/health/**").permitAll()

                        .requestMatchers("/auth/signup", "/auth/otp", "/auth/verify").permitAll()
                        .anyRequest().denyAll()
                )
                .build();
    }
}
