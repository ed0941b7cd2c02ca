package com.sparta.reward.infrastructure.config;


import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redisson 분산 락 설정
 * 계정 단위 보상 요청 직렬화에 사용하는 RedissonClient 빈을 생성
 */
@Configuration
public class RedissonConfig {

    // Redis 프로토콜 프리픽스
    private static final String REDIS_PROTOCOL_PREFIX = "redis://";

    // 커넥션 풀 설정값
    private static final int CONNECTION_MINIMUM_IDLE_SIZE = 10;
    private static final int CONNECTION_POOL_SIZE = 20;
    private static final int IDLE_CONNECTION_TIMEOUT = 10000;
    private static final int CONNECT_TIMEOUT = 3000;
    private static final int COMMAND_TIMEOUT = 3000;

    @Value("${spring.data.redis.host}")
    private String redisHost;

    @Value("${spring.data.redis.port}")
    private int redisPort;

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient() {
        Config config = new Config();

        // 단일 Redis 서버 모드 (standalone)
        config.useSingleServer()
                .setAddress(REDIS_PROTOCOL_PREFIX + redisHost + ":" + redisPort)
                .setConnectionMinimumIdleSize(CONNECTION_MINIMUM_IDLE_SIZE)
                .setConnectionPoolSize(CONNECTION_POOL_SIZE)
                // 10초 동안 사용되지 않은 연결은 해제
                .setIdleConnectionTimeout(IDLE_CONNECTION_TIMEOUT)
                .setConnectTimeout(CONNECT_TIMEOUT)
                .setTimeout(COMMAND_TIMEOUT);

        return Redisson.create(config);
    }
}
