package com.credcore.backend.auth.config;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneId;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * @Configuration
 * - 이 클래스가 "스프링 설정 클래스"임을 의미
 * - @Bean 메서드에서 반환하는 객체들이 스프링 컨테이너(ApplicationContext)에 등록됨
 *
 * @EnableConfigurationProperties
 *  - @ConfigurationProperties가 붙은 record들을 스프링이 바인딩 + 검증(fail-fast)하도록 활성화
 */
@Configuration
@EnableConfigurationProperties({
        OtpProperties.class,
        CryptoProperties.class,
        SignupProperties.class,
        MailerProperties.class,
        SmsProperties.class,
        DeliveryProperties.class,
        AuthProperties.class
})
public class AuthModuleConfig {

    private static final ZoneId KST = ZoneId.of("Asia/Seoul");

    /**
     * java.time.Clock:
     * - 서버 표준 타임존을 KST로 강제한다(프로젝트 정책).
     * - 다른 Clock 빈(테스트의 TestClockConfig)이 있으면 만들지 않는다.
     */
    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.system(KST);
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    /**
     * 메일/SMS 발송 전용 스레드 풀
     * - 요청 스레드는 deadline까지만 기다린다(DeliveryGateway).
     * - 큐가 가득 차면 TaskRejectedException → 발송 실패로 취급된다.
     * - 종료 시에는 이미 받은 발송을 deadline만큼 기다린 뒤 내려간다.
     */
    @Bean
    public ThreadPoolTaskExecutor deliveryExecutor(DeliveryProperties props) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(props.poolSize());
        ex.setMaxPoolSize(props.poolSize());
        ex.setQueueCapacity(props.queueCapacity());
        ex.setThreadNamePrefix("delivery-");
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.setAwaitTerminationMillis(props.timeoutMillis());
        return ex;
    }
}
