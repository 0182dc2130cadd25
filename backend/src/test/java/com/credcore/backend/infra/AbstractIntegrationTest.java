package com.credcore.backend.infra;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.test.context.ActiveProfiles;

import com.credcore.backend.auth.delivery.SmsSender;

/**
 * 통합 테스트 공통 베이스 (H2, MySQL 모드 + Flyway)
 *
 * 1) @SpringBootTest: 애플리케이션 컨텍스트 전체를 띄운다.
 * 2) @ActiveProfiles("test"): application.yml + application-test.yml
 * 3) 외부 발송(메일/SMS)은 @MockBean으로 대체한다.
 *    - 발송 성공/실패/지연을 테스트가 직접 조종한다.
 *    - 메일/SMS 본문은 ArgumentCaptor로 꺼내 코드/토큰을 확인한다.
 * 4) MockBean 구성을 베이스에 모아 두어 모든 하위 테스트가 같은 컨텍스트를 재사용한다.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestClockConfig.class)
public abstract class AbstractIntegrationTest {

    @MockBean protected JavaMailSender javaMailSender;
    @MockBean protected SmsSender smsSender;

    @BeforeEach
    void resetTestClock() {
        TestClockConfig.reset();
    }
}
