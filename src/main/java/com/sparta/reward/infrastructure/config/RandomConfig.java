package com.sparta.reward.infrastructure.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

/**
 * 보상 추첨용 난수 생성기 설정
 * 가중치 추첨, 서브 옵션 추첨에서 공유한다
 */
@Configuration
public class RandomConfig {

    @Bean
    public Random rewardRandom() {
        return new Random();
    }
}
