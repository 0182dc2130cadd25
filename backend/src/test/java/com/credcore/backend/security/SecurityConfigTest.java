package com.credcore.backend.security;

import static com.credcore.backend.auth.support.AuthHttpSupport.expectErrorWithCode;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationContext;
import org.springframework.test.web.servlet.MockMvc;

import com.credcore.backend.global.ErrorCode;
import com.credcore.backend.infra.AbstractIntegrationTest;

/**
 * 열려 있는 것은 가입/확인 3개 엔드포인트와 health 뿐이다.
 * 그 외 요청은 공통 에러 포맷의 401 AUTH_REQUIRED.
 */
@DisplayName("[Security] 접근 규칙")
class SecurityConfigTest extends AbstractIntegrationTest {

    @Autowired MockMvc mvc;
    @Autowired ApplicationContext context;

    @Test
    @DisplayName("GET /actuator/health → 200 (익명 허용)")
    void health_is_open() throws Exception {
        mvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    @DisplayName("메일 발송기가 mock이면 mail health 기여자는 등록되지 않는다")
    void mail_health_is_disabled_in_tests() {
        assertThat(context.containsBean("mailHealthContributor")).isFalse();
    }

    @Test
    @DisplayName("알 수 없는 경로 → 401 AUTH_REQUIRED")
    void unknown_route_requires_auth() throws Exception {
        expectErrorWithCode(mvc.perform(get("/auth/me")), ErrorCode.AUTH_REQUIRED);
        expectErrorWithCode(mvc.perform(post("/auth/logout")), ErrorCode.AUTH_REQUIRED);
    }

    @Test
    @DisplayName("actuator의 health 외 엔드포인트 → 401")
    void other_actuator_endpoints_are_closed() throws Exception {
        expectErrorWithCode(mvc.perform(get("/actuator/env")), ErrorCode.AUTH_REQUIRED);
    }
}
