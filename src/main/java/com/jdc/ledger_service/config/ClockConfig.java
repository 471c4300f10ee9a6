package com.jdc.ledger_service.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * "오늘"은 항상 설정된 시간대 기준. 테스트에서는 고정 Clock 으로 교체한다.
 */
@Configuration
@RequiredArgsConstructor
public class ClockConfig {

    private final LedgerProperties props;

    @Bean
    public Clock clock() {
        return Clock.system(props.zoneId());
    }
}
