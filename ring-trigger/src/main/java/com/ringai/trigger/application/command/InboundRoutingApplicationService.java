package com.ringai.trigger.application.command;

import com.ringai.domain.routing.adapter.repository.IInteractionRepository;
import com.ringai.domain.routing.model.entity.InteractionEntity;
import com.ringai.domain.routing.model.valobj.IncomingCall;
import com.ringai.domain.routing.model.valobj.RoutingDecision;
import com.ringai.domain.routing.service.InboundCallRouter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 呼入路由用例：在公共线程池上执行同步的仓储查询与规则评估，以 Future 交还给网关处理器。
 * <p>
 * 任何异常都降级为 ANSWER；交互记录异步写入，失败只记录日志。
 * </p>
 */
@Slf4j
@Service
public class InboundRoutingApplicationService {

    private final InboundCallRouter inboundCallRouter;
    private final IInteractionRepository interactionRepository;
    private final Executor commonThreadPoolExecutor;
    private final Clock clock;
    private final ZoneId zoneId;
    private final MeterRegistry meterRegistry;
    private final Counter interactionFailCounter;

    public InboundRoutingApplicationService(InboundCallRouter inboundCallRouter,
                                            IInteractionRepository interactionRepository,
                                            @Qualifier("commonThreadPoolExecutor") Executor commonThreadPoolExecutor,
                                            Clock clock,
                                            ObjectProvider<MeterRegistry> meterRegistryProvider,
                                            @Value("${ring.bridge.routing.zone-id:UTC}") String zoneId) {
        this.inboundCallRouter = inboundCallRouter;
        this.interactionRepository = interactionRepository;
        this.commonThreadPoolExecutor = commonThreadPoolExecutor;
        this.clock = clock;
        this.zoneId = ZoneId.of(zoneId);
        this.meterRegistry = meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new);
        this.interactionFailCounter = Counter.builder("ring.routing.interaction.fail.total").register(meterRegistry);
    }

    /**
     * 评估一通来电的路由决策，返回的 Future 不会以异常结束。
     */
    public CompletableFuture<RoutingDecision> route(IncomingCall call) {
        return CompletableFuture
                .supplyAsync(() -> inboundCallRouter.route(call, now()), commonThreadPoolExecutor)
                .exceptionally(ex -> {
                    log.error("Routing failed, fail open to ANSWER. callId={}, gatewayId={}",
                            call.callId(), call.gatewayId(), ex);
                    return RoutingDecision.answer(call.callId());
                })
                .thenApply(decision -> {
                    Counter.builder("ring.routing.decision.total")
                            .tag("action", decision.getAction().getCode())
                            .register(meterRegistry)
                            .increment();
                    return decision;
                });
    }

    /**
     * 异步追加一条交互记录；决策没有组织归属时跳过。
     */
    public CompletableFuture<Void> recordInteraction(IncomingCall call, RoutingDecision decision) {
        return CompletableFuture.runAsync(() -> {
            InteractionEntity interaction = inboundCallRouter.buildInteraction(call, decision,
                    LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC));
            if (interaction == null) {
                log.debug("Skip interaction logging without organization. callId={}", call.callId());
                return;
            }
            interactionRepository.save(interaction);
            log.info("Inbound interaction recorded. callId={}, interactionId={}, action={}",
                    call.callId(), interaction.getId(), decision.getAction().getCode());
        }, commonThreadPoolExecutor).exceptionally(ex -> {
            interactionFailCounter.increment();
            log.warn("Failed to record inbound interaction. callId={}, error={}", call.callId(), ex.getMessage());
            return null;
        });
    }

    private LocalDateTime now() {
        return LocalDateTime.ofInstant(clock.instant(), zoneId);
    }
}
