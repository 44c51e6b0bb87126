package com.example.collab.shared.config;

import com.example.collab.shared.util.Constants;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.redis.spring.RedisLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.connection.RedisConnectionFactory;

/**
 * ShedLock keeps cluster-wide maintenance jobs (such as reaping dead instances) running on
 * one instance at a time.
 */
@Configuration
@EnableSchedulerLock(defaultLockAtMostFor = "PT30S")
@Profile("!" + Constants.LOCAL_PROFILE)
public class ShedLockConfig {

    /**
     * Scheduler locks live in the same Redis as the edit locks, under a per-cluster environment prefix.
     */
    @Bean
    public LockProvider lockProvider(RedisConnectionFactory connectionFactory, AppProperties appProperties) {
        return new RedisLockProvider(connectionFactory, Constants.CHANNEL_ROOT + "-" + appProperties.getClusterName());
    }
}
