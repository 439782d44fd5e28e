package com.ringai.test.domain;

import com.ringai.domain.routing.adapter.repository.IInboundRoutingRuleRepository;
import com.ringai.domain.routing.model.entity.ContactEntity;
import com.ringai.domain.routing.model.entity.GatewayPhoneEntity;
import com.ringai.domain.routing.model.entity.InboundRoutingRuleEntity;
import com.ringai.domain.routing.model.entity.InteractionEntity;
import com.ringai.domain.routing.model.valobj.IncomingCall;
import com.ringai.domain.routing.model.valobj.RoutingDecision;
import com.ringai.domain.routing.service.InboundCallRouter;
import com.ringai.test.support.InMemoryContactRepository;
import com.ringai.test.support.InMemoryGatewayPhoneRepository;
import com.ringai.test.support.InMemoryInboundRoutingRuleRepository;
import com.ringai.types.common.Constants;
import com.ringai.types.enums.InteractionStatusEnum;
import com.ringai.types.enums.InteractionTypeEnum;
import com.ringai.types.enums.RoutingActionEnum;
import com.ringai.types.enums.RoutingMatchTypeEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class InboundCallRouterTest {

    private static final String ORG_ID = "org-1";
    private static final String GATEWAY_ID = "gw-1";
    /** 2026-03-02 是周一 */
    private static final LocalDateTime MONDAY_NOON = LocalDateTime.of(2026, 3, 2, 12, 0);

    private InMemoryGatewayPhoneRepository gatewayPhoneRepository;
    private InMemoryContactRepository contactRepository;
    private InMemoryInboundRoutingRuleRepository routingRuleRepository;
    private InboundCallRouter router;
    private GatewayPhoneEntity device;

    @BeforeEach
    public void setUp() {
        this.gatewayPhoneRepository = new InMemoryGatewayPhoneRepository();
        this.contactRepository = new InMemoryContactRepository();
        this.routingRuleRepository = new InMemoryInboundRoutingRuleRepository();
        this.router = new InboundCallRouter(gatewayPhoneRepository, contactRepository, routingRuleRepository);

        this.device = new GatewayPhoneEntity();
        device.setId("phone-1");
        device.setGatewayId(GATEWAY_ID);
        device.setOrgId(ORG_ID);
        device.setIsActive(true);
        device.setAutoAnswer(true);
        device.setSystemInstruction("Default greeting");
        device.setVoiceName("Kore");
        gatewayPhoneRepository.save(device);
    }

    @Test
    public void shouldAnswerUnknownGatewayWithoutQueryingRules() {
        RoutingDecision decision = router.route(call("+9779800000001", "gw-unknown"), MONDAY_NOON);

        Assertions.assertEquals(RoutingActionEnum.ANSWER, decision.getAction());
        Assertions.assertNull(decision.getOrgId());
        Assertions.assertNull(decision.getSystemInstruction());
        Assertions.assertEquals(0, routingRuleRepository.getQueryCount());
    }

    @Test
    public void shouldAnswerInactiveGatewayWithoutQueryingRules() {
        device.setIsActive(false);

        RoutingDecision decision = router.route(call("+9779800000001", GATEWAY_ID), MONDAY_NOON);

        Assertions.assertEquals(RoutingActionEnum.ANSWER, decision.getAction());
        Assertions.assertEquals(0, routingRuleRepository.getQueryCount());
    }

    @Test
    public void shouldForwardOnPrefixMatch() {
        InboundRoutingRuleEntity rule = rule("nepal", RoutingMatchTypeEnum.PREFIX, RoutingActionEnum.FORWARD, 1);
        rule.setCallerPattern("+977*");
        rule.setForwardTo("+9779811111111");
        routingRuleRepository.save(rule);

        RoutingDecision decision = router.route(call("+9779812345678", GATEWAY_ID), MONDAY_NOON);

        Assertions.assertEquals(RoutingActionEnum.FORWARD, decision.getAction());
        Assertions.assertEquals("+9779811111111", decision.getForwardTo());
        Assertions.assertEquals("nepal", decision.getRuleName());
        Assertions.assertEquals(ORG_ID, decision.getOrgId());
        Assertions.assertEquals("phone-1", decision.getGatewayPhoneId());
    }

    @Test
    public void shouldNotMatchPrefixForOtherCountries() {
        InboundRoutingRuleEntity rule = rule("nepal", RoutingMatchTypeEnum.PREFIX, RoutingActionEnum.FORWARD, 1);
        rule.setCallerPattern("+977*");
        rule.setForwardTo("+9779811111111");
        routingRuleRepository.save(rule);

        Assertions.assertTrue(router.matches(rule, "+9779800000", null, MONDAY_NOON));
        Assertions.assertFalse(router.matches(rule, "+15551234567", null, MONDAY_NOON));

        RoutingDecision decision = router.route(call("+15551234567", GATEWAY_ID), MONDAY_NOON);

        Assertions.assertEquals(RoutingActionEnum.ANSWER, decision.getAction());
        Assertions.assertNull(decision.getRuleId());
        Assertions.assertNull(decision.getForwardTo());
    }

    @Test
    public void shouldAutoAnswerWithDeviceDefaultsWhenNoRuleMatches() {
        InboundRoutingRuleEntity rule = rule("india", RoutingMatchTypeEnum.PREFIX, RoutingActionEnum.REJECT, 1);
        rule.setCallerPattern("+91*");
        routingRuleRepository.save(rule);

        RoutingDecision decision = router.route(call("+9779812345678", GATEWAY_ID), MONDAY_NOON);

        Assertions.assertEquals(RoutingActionEnum.ANSWER, decision.getAction());
        Assertions.assertNull(decision.getRuleId());
        Assertions.assertEquals("Default greeting", decision.getSystemInstruction());
        Assertions.assertEquals("Kore", decision.getVoiceName());
    }

    @Test
    public void shouldRejectWhenNoRuleMatchesAndAutoAnswerDisabled() {
        device.setAutoAnswer(false);

        RoutingDecision decision = router.route(call("+9779812345678", GATEWAY_ID), MONDAY_NOON);

        Assertions.assertEquals(RoutingActionEnum.REJECT, decision.getAction());
        Assertions.assertEquals(Constants.REJECT_REASON_NO_MATCHING_RULE, decision.getRejectReason());
    }

    @Test
    public void shouldEvaluateRulesByAscendingPriority() {
        routingRuleRepository.save(rule("answer-all", RoutingMatchTypeEnum.ALL, RoutingActionEnum.ANSWER, 5));
        routingRuleRepository.save(rule("reject-all", RoutingMatchTypeEnum.ALL, RoutingActionEnum.REJECT, 1));

        RoutingDecision decision = router.route(call("+9779812345678", GATEWAY_ID), MONDAY_NOON);

        Assertions.assertEquals(RoutingActionEnum.REJECT, decision.getAction());
        Assertions.assertEquals("reject-all", decision.getRuleName());
    }

    @Test
    public void shouldTreatNullPriorityAsZeroAndKeepInsertionOrderOnTies() {
        InboundRoutingRuleEntity first = rule("first", RoutingMatchTypeEnum.ALL, RoutingActionEnum.REJECT, 0);
        InboundRoutingRuleEntity second = rule("second", RoutingMatchTypeEnum.ALL, RoutingActionEnum.ANSWER, null);
        InboundRoutingRuleEntity later = rule("later", RoutingMatchTypeEnum.ALL, RoutingActionEnum.ANSWER, 3);

        RoutingDecision decision = router.decide(call("+1", GATEWAY_ID), device, null,
                List.of(later, first, second), MONDAY_NOON);

        Assertions.assertEquals("first", decision.getRuleName());
    }

    @Test
    public void shouldSkipInactiveRules() {
        InboundRoutingRuleEntity inactive = rule("inactive", RoutingMatchTypeEnum.ALL, RoutingActionEnum.REJECT, 0);
        inactive.setIsActive(false);

        RoutingDecision decision = router.decide(call("+1", GATEWAY_ID), device, null, List.of(inactive), MONDAY_NOON);

        Assertions.assertEquals(RoutingActionEnum.ANSWER, decision.getAction());
        Assertions.assertNull(decision.getRuleName());
    }

    @Test
    public void shouldMatchOvernightWindowAcrossMidnight() {
        LocalTime start = LocalTime.of(22, 0);
        LocalTime end = LocalTime.of(6, 0);

        Assertions.assertTrue(InboundCallRouter.withinTimeWindow(start, end, LocalTime.of(23, 30)));
        Assertions.assertTrue(InboundCallRouter.withinTimeWindow(start, end, LocalTime.of(2, 0)));
        Assertions.assertTrue(InboundCallRouter.withinTimeWindow(start, end, LocalTime.of(6, 0)));
        Assertions.assertFalse(InboundCallRouter.withinTimeWindow(start, end, LocalTime.of(12, 0)));
    }

    @Test
    public void shouldIncludeBothEndsOfDaytimeWindow() {
        LocalTime start = LocalTime.of(9, 0);
        LocalTime end = LocalTime.of(17, 0);

        Assertions.assertTrue(InboundCallRouter.withinTimeWindow(start, end, LocalTime.of(9, 0)));
        Assertions.assertTrue(InboundCallRouter.withinTimeWindow(start, end, LocalTime.of(17, 0)));
        Assertions.assertFalse(InboundCallRouter.withinTimeWindow(start, end, LocalTime.of(17, 0, 1)));
        Assertions.assertTrue(InboundCallRouter.withinTimeWindow(null, null, LocalTime.of(3, 0)));
        Assertions.assertTrue(InboundCallRouter.withinTimeWindow(null, end, LocalTime.MIDNIGHT));
    }

    @Test
    public void shouldRejectAfterHoursWithOvernightRule() {
        InboundRoutingRuleEntity afterHours = rule("after-hours", RoutingMatchTypeEnum.ALL, RoutingActionEnum.REJECT, 1);
        afterHours.setTimeStart(LocalTime.of(22, 0));
        afterHours.setTimeEnd(LocalTime.of(6, 0));
        routingRuleRepository.save(afterHours);

        RoutingDecision night = router.route(call("+1", GATEWAY_ID), LocalDateTime.of(2026, 3, 2, 23, 15));
        RoutingDecision noon = router.route(call("+1", GATEWAY_ID), MONDAY_NOON);

        Assertions.assertEquals(RoutingActionEnum.REJECT, night.getAction());
        Assertions.assertEquals(RoutingActionEnum.ANSWER, noon.getAction());
    }

    @Test
    public void shouldHonourDaysOfWeekWithMondayAsZero() {
        InboundRoutingRuleEntity weekend = rule("weekend", RoutingMatchTypeEnum.ALL, RoutingActionEnum.REJECT, 1);
        weekend.setDaysOfWeek(List.of(5, 6));
        InboundRoutingRuleEntity monday = rule("monday", RoutingMatchTypeEnum.ALL, RoutingActionEnum.FORWARD, 2);
        monday.setDaysOfWeek(List.of(0));
        monday.setForwardTo("+9779811111111");

        RoutingDecision weekday = router.decide(call("+1", GATEWAY_ID), device, null,
                List.of(weekend, monday), MONDAY_NOON);
        RoutingDecision sunday = router.decide(call("+1", GATEWAY_ID), device, null,
                List.of(weekend, monday), LocalDateTime.of(2026, 3, 8, 12, 0));

        Assertions.assertEquals("monday", weekday.getRuleName());
        Assertions.assertEquals("weekend", sunday.getRuleName());
    }

    @Test
    public void shouldMatchExactCallerOnly() {
        InboundRoutingRuleEntity vip = rule("vip", RoutingMatchTypeEnum.EXACT, RoutingActionEnum.ANSWER, 1);
        vip.setCallerPattern("+9779800000001");

        Assertions.assertTrue(router.matches(vip, "+9779800000001", null, MONDAY_NOON));
        Assertions.assertFalse(router.matches(vip, "+97798000000012", null, MONDAY_NOON));
        Assertions.assertFalse(router.matches(vip, null, null, MONDAY_NOON));
    }

    @Test
    public void shouldMatchContactOnlyForKnownCallers() {
        ContactEntity contact = new ContactEntity();
        contact.setId("contact-1");
        contact.setOrgId(ORG_ID);
        contact.setPhone("+9779800000001");
        contact.setName("Sita");
        contactRepository.save(contact);
        routingRuleRepository.save(rule("contacts", RoutingMatchTypeEnum.CONTACT_ONLY, RoutingActionEnum.ANSWER, 1));
        device.setAutoAnswer(false);

        RoutingDecision known = router.route(call("+9779800000001", GATEWAY_ID), MONDAY_NOON);
        RoutingDecision stranger = router.route(call("+9779800000002", GATEWAY_ID), MONDAY_NOON);

        Assertions.assertEquals(RoutingActionEnum.ANSWER, known.getAction());
        Assertions.assertEquals("contact-1", known.getContactId());
        Assertions.assertEquals("Sita", known.getContactName());
        Assertions.assertEquals(RoutingActionEnum.REJECT, stranger.getAction());
        Assertions.assertNull(stranger.getContactId());
    }

    @Test
    public void shouldPreferRuleOverridesAndFallBackToDeviceDefaults() {
        InboundRoutingRuleEntity rule = rule("support", RoutingMatchTypeEnum.ALL, RoutingActionEnum.ANSWER, 1);
        rule.setSystemInstruction("Support line");
        rule.setVoiceName(" ");

        RoutingDecision decision = router.decide(call("+1", GATEWAY_ID), device, null, List.of(rule), MONDAY_NOON);

        Assertions.assertEquals("Support line", decision.getSystemInstruction());
        Assertions.assertEquals("Kore", decision.getVoiceName());
    }

    @Test
    public void shouldSkipInvalidRuleAndKeepEvaluatingLaterRules() {
        device.setAutoAnswer(false);
        routingRuleRepository.save(rule("broken", null, RoutingActionEnum.ANSWER, 1));
        routingRuleRepository.save(rule("block", RoutingMatchTypeEnum.ALL, RoutingActionEnum.REJECT, 2));

        RoutingDecision decision = router.route(call("+9779800000001", GATEWAY_ID), MONDAY_NOON);

        Assertions.assertEquals(RoutingActionEnum.REJECT, decision.getAction());
        Assertions.assertEquals("rule-block", decision.getRuleId());
    }

    @Test
    public void shouldFallBackToDeviceWhenOnlyInvalidRulesExist() {
        InboundRoutingRuleEntity noAction = rule("no-action", RoutingMatchTypeEnum.ALL, null, 1);
        routingRuleRepository.save(noAction);

        RoutingDecision decision = router.route(call("+1", GATEWAY_ID), MONDAY_NOON);

        Assertions.assertEquals(RoutingActionEnum.ANSWER, decision.getAction());
        Assertions.assertNull(decision.getRuleId());
        Assertions.assertEquals("Default greeting", decision.getSystemInstruction());
    }

    @Test
    public void shouldFailOpenWhenEvaluationErrors() {
        IInboundRoutingRuleRepository failingRules = mock(IInboundRoutingRuleRepository.class);
        when(failingRules.listActiveByOrgId(ORG_ID)).thenThrow(new IllegalStateException("database down"));
        device.setAutoAnswer(false);
        InboundCallRouter failingRouter = new InboundCallRouter(gatewayPhoneRepository, contactRepository, failingRules);

        RoutingDecision decision = failingRouter.route(call("+1", GATEWAY_ID), MONDAY_NOON);

        Assertions.assertEquals(RoutingActionEnum.ANSWER, decision.getAction());
        Assertions.assertEquals("call-1", decision.getCallId());
    }

    @Test
    public void shouldBuildInteractionForOrganisationDecisions() {
        IncomingCall call = call("+9779800000001", GATEWAY_ID);
        RoutingDecision decision = router.route(call, MONDAY_NOON);

        InteractionEntity interaction = router.buildInteraction(call, decision, MONDAY_NOON);

        Assertions.assertEquals(ORG_ID, interaction.getOrgId());
        Assertions.assertEquals(InteractionTypeEnum.INBOUND_CALL, interaction.getType());
        Assertions.assertEquals(InteractionStatusEnum.IN_PROGRESS, interaction.getStatus());
        Assertions.assertEquals(MONDAY_NOON, interaction.getStartedAt());
        Assertions.assertEquals("call-1", interaction.getMetadata().get("call_id"));
        Assertions.assertEquals("answer", interaction.getMetadata().get("routing_action"));
        Assertions.assertEquals("Ncell", interaction.getMetadata().get("carrier"));
        Assertions.assertEquals(1, interaction.getMetadata().get("sim_slot"));
    }

    @Test
    public void shouldMarkRejectedInteractionCompleted() {
        device.setAutoAnswer(false);
        IncomingCall call = call("+1", GATEWAY_ID);

        InteractionEntity interaction = router.buildInteraction(call, router.route(call, MONDAY_NOON), MONDAY_NOON);

        Assertions.assertEquals(InteractionStatusEnum.COMPLETED, interaction.getStatus());
    }

    @Test
    public void shouldSkipInteractionWithoutOrganisation() {
        IncomingCall call = call("+1", "gw-unknown");

        Assertions.assertNull(router.buildInteraction(call, router.route(call, MONDAY_NOON), MONDAY_NOON));
    }

    private IncomingCall call(String from, String gatewayId) {
        return new IncomingCall("call-1", from, "+9779700000000", "Ncell", 1, gatewayId);
    }

    private InboundRoutingRuleEntity rule(String name, RoutingMatchTypeEnum matchType, RoutingActionEnum action,
                                          Integer priority) {
        InboundRoutingRuleEntity rule = new InboundRoutingRuleEntity();
        rule.setId("rule-" + name);
        rule.setOrgId(ORG_ID);
        rule.setName(name);
        rule.setMatchType(matchType);
        rule.setAction(action);
        rule.setIsActive(true);
        rule.setPriority(priority);
        return rule;
    }
}
