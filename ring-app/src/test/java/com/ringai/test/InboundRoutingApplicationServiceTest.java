package com.ringai.test;

import com.ringai.domain.routing.model.entity.GatewayPhoneEntity;
import com.ringai.domain.routing.model.entity.InteractionEntity;
import com.ringai.domain.routing.model.valobj.IncomingCall;
import com.ringai.domain.routing.model.valobj.RoutingDecision;
import com.ringai.domain.routing.service.InboundCallRouter;
import com.ringai.test.support.InMemoryContactRepository;
import com.ringai.test.support.InMemoryGatewayPhoneRepository;
import com.ringai.test.support.InMemoryInboundRoutingRuleRepository;
import com.ringai.test.support.InMemoryInteractionRepository;
import com.ringai.trigger.application.command.InboundRoutingApplicationService;
import com.ringai.domain.routing.adapter.repository.IInteractionRepository;
import com.ringai.types.enums.RoutingActionEnum;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class InboundRoutingApplicationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T17:30:00Z");

    private InMemoryGatewayPhoneRepository gatewayPhoneRepository;
    private InMemoryInteractionRepository interactionRepository;
    private InboundCallRouter router;
    private MeterRegistry meterRegistry;
    private ObjectProvider<MeterRegistry> meterRegistryProvider;
    private Clock clock;

    @BeforeEach
    public void setUp() {
        this.gatewayPhoneRepository = new InMemoryGatewayPhoneRepository();
        this.interactionRepository = new InMemoryInteractionRepository();
        this.router = new InboundCallRouter(gatewayPhoneRepository, new InMemoryContactRepository(),
                new InMemoryInboundRoutingRuleRepository());
        this.meterRegistry = new SimpleMeterRegistry();
        DefaultListableBeanFactory beanFactory = new DefaultListableBeanFactory();
        beanFactory.registerSingleton("meterRegistry", meterRegistry);
        this.meterRegistryProvider = beanFactory.getBeanProvider(MeterRegistry.class);
        this.clock = Clock.fixed(NOW, ZoneOffset.UTC);

        GatewayPhoneEntity device = new GatewayPhoneEntity();
        device.setId("phone-1");
        device.setGatewayId("gw-1");
        device.setOrgId("org-1");
        device.setIsActive(true);
        device.setAutoAnswer(false);
        gatewayPhoneRepository.save(device);
    }

    @Test
    public void shouldRouteOnExecutorAndCountDecision() {
        InboundRoutingApplicationService service = newService(router, interactionRepository, "UTC");

        RoutingDecision decision = service.route(call("gw-1")).join();

        Assertions.assertEquals(RoutingActionEnum.REJECT, decision.getAction());
        Assertions.assertEquals(1.0D, meterRegistry.get("ring.routing.decision.total")
                .tag("action", "reject").counter().count());
    }

    @Test
    public void shouldFailOpenWhenRouterThrows() {
        InboundCallRouter broken = mock(InboundCallRouter.class);
        when(broken.route(any(), any())).thenThrow(new IllegalStateException("database down"));
        InboundRoutingApplicationService service = newService(broken, interactionRepository, "UTC");

        RoutingDecision decision = service.route(call("gw-1")).join();

        Assertions.assertEquals(RoutingActionEnum.ANSWER, decision.getAction());
        Assertions.assertEquals("call-1", decision.getCallId());
    }

    @Test
    public void shouldRecordInteractionWithUtcStartTime() {
        InboundRoutingApplicationService service = newService(router, interactionRepository, "Asia/Kathmandu");
        IncomingCall call = call("gw-1");
        RoutingDecision decision = service.route(call).join();

        service.recordInteraction(call, decision).join();

        Assertions.assertEquals(1, interactionRepository.getStore().size());
        InteractionEntity saved = interactionRepository.getStore().get(0);
        Assertions.assertNotNull(saved.getId());
        Assertions.assertEquals(LocalDateTime.of(2026, 3, 2, 17, 30), saved.getStartedAt());
    }

    @Test
    public void shouldSkipInteractionForUnknownGateway() {
        InboundRoutingApplicationService service = newService(router, interactionRepository, "UTC");
        IncomingCall call = call("gw-unknown");

        service.recordInteraction(call, service.route(call).join()).join();

        Assertions.assertTrue(interactionRepository.getStore().isEmpty());
    }

    @Test
    public void shouldSwallowInteractionFailureAndCountIt() {
        IInteractionRepository failing = mock(IInteractionRepository.class);
        when(failing.save(any())).thenThrow(new IllegalStateException("insert failed"));
        InboundRoutingApplicationService service = newService(router, failing, "UTC");
        IncomingCall call = call("gw-1");

        Assertions.assertDoesNotThrow(() -> service.recordInteraction(call, service.route(call).join()).join());

        Assertions.assertEquals(1.0D, meterRegistry.get("ring.routing.interaction.fail.total").counter().count());
    }

    private InboundRoutingApplicationService newService(InboundCallRouter callRouter,
                                                        IInteractionRepository repository,
                                                        String zoneId) {
        return new InboundRoutingApplicationService(callRouter, repository, Runnable::run, clock,
                meterRegistryProvider, zoneId);
    }

    private IncomingCall call(String gatewayId) {
        return new IncomingCall("call-1", "+9779800000001", "+9779700000000", "", 0, gatewayId);
    }
}
