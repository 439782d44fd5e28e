package com.ringai.config;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.ringai.domain.call.adapter.repository.IExpiringStore;
import com.ringai.domain.routing.model.valobj.RoutingDecision;
import com.ringai.infrastructure.store.GuavaExpiringStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Guava 缓存配置。
 * <p>
 * 待接通的路由决策在 INCOMING_CALL 与 CALL_CONNECTED 之间暂存，写入后按 TTL 过期，
 * 并限制总条数，设备未回报接通时不会无限堆积。
 * </p>
 *
 * @author ringai
 * @since 2026-03-05
 */
@Configuration
public class GuavaConfig {

    @Bean(name = "pendingDecisionCache")
    public Cache<String, RoutingDecision> pendingDecisionCache(BridgeProperties properties) {
        BridgeProperties.Routing routing = properties.getRouting();
        return CacheBuilder.newBuilder()
                .expireAfterWrite(Math.max(routing.getPendingDecisionTtlSeconds(), 1L), TimeUnit.SECONDS)
                .maximumSize(Math.max(routing.getPendingDecisionMaxSize(), 1L))
                .build();
    }

    @Bean
    public IExpiringStore<String, RoutingDecision> pendingDecisionStore(Cache<String, RoutingDecision> pendingDecisionCache) {
        return new GuavaExpiringStore<>(pendingDecisionCache);
    }

}
