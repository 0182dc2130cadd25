package com.credcore.backend.infra;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.testcontainers.containers.MySQLContainer;

public final class TestDynamicProperties {

    private TestDynamicProperties() {}

    public static void overrideProps(DynamicPropertyRegistry r, MySQLContainer<?> mysql) {

        // --- DB ---
        r.add("spring.datasource.url", mysql::getJdbcUrl);
        r.add("spring.datasource.username", mysql::getUsername);
        r.add("spring.datasource.password", mysql::getPassword);
        r.add("spring.datasource.driver-class-name", () -> "com.mysql.cj.jdbc.Driver");

        // --- JPA: 실제 MySQL에서는 엔티티 ↔ 스키마 일치까지 검증 ---
        r.add("spring.jpa.hibernate.ddl-auto", () -> "validate");

        // --- Flyway ---
        r.add("spring.flyway.url", mysql::getJdbcUrl);
        r.add("spring.flyway.user", mysql::getUsername);
        r.add("spring.flyway.password", mysql::getPassword);

        // --- Hikari ---
        r.add("spring.datasource.hikari.connection-timeout", () -> "30000");
        r.add("spring.datasource.hikari.initialization-fail-timeout", () -> "-1");

        TestInfraLogger.logOverrideRegistered(mysql);
    }
}
