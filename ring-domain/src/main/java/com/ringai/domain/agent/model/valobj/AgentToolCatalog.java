package com.ringai.domain.agent.model.valobj;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 会话可启用的工具声明目录。会话配置里的 toolNames 必须出自这里。
 */
public final class AgentToolCatalog {

    public static final String LOOKUP_ACCOUNT = "lookup_account";
    public static final String CHECK_BALANCE = "check_balance";
    public static final String INITIATE_PAYMENT = "initiate_payment";
    public static final String TRANSFER_TO_HUMAN = "transfer_to_human";

    private static final Map<String, AgentToolDefinition> DEFINITIONS;

    static {
        Map<String, AgentToolDefinition> definitions = new LinkedHashMap<>();
        definitions.put(LOOKUP_ACCOUNT, new AgentToolDefinition(LOOKUP_ACCOUNT,
                "Look up a customer account by phone number. "
                        + "Returns the customer's name, account ID, and basic profile information. "
                        + "Use this when the caller asks about their account or needs to verify identity.",
                objectSchema(Map.of("phone_number",
                                stringProperty("The customer's phone number in E.164 format (e.g. +9771234567890)")),
                        List.of("phone_number"))));
        definitions.put(CHECK_BALANCE, new AgentToolDefinition(CHECK_BALANCE,
                "Check the credit balance for an organization. "
                        + "Returns current balance, total purchased, and total consumed credits. "
                        + "Use this when the caller asks about their remaining credits or balance.",
                objectSchema(Map.of("org_id", stringProperty("The organization UUID to check balance for")),
                        List.of("org_id"))));
        definitions.put(INITIATE_PAYMENT, new AgentToolDefinition(INITIATE_PAYMENT,
                "Initiate a credit purchase for an organization. "
                        + "Adds the specified amount of credits to the organization's balance. "
                        + "Always confirm the amount with the caller before executing.",
                objectSchema(Map.of(
                                "org_id", stringProperty("The organization UUID to add credits to"),
                                "amount", Map.of("type", "number",
                                        "description", "The amount of credits to purchase (must be positive)"),
                                "description", stringProperty("Description of the payment")),
                        List.of("org_id", "amount"))));
        definitions.put(TRANSFER_TO_HUMAN, new AgentToolDefinition(TRANSFER_TO_HUMAN,
                "Transfer the current call to a human operator. "
                        + "Use this when the caller explicitly asks to speak with a human, "
                        + "or when the issue is too complex to handle automatically. "
                        + "Provide a reason and summary for the human operator.",
                objectSchema(Map.of(
                                "reason", stringProperty("Why the transfer is happening (e.g. 'caller_request', 'escalation')"),
                                "summary", stringProperty("Brief summary of the conversation so far")),
                        List.of("reason"))));
        DEFINITIONS = Collections.unmodifiableMap(definitions);
    }

    private AgentToolCatalog() {
    }

    public static boolean contains(String name) {
        return name != null && DEFINITIONS.containsKey(name);
    }

    public static Set<String> names() {
        return DEFINITIONS.keySet();
    }

    /**
     * 按名称取声明，未知名称直接抛错。
     */
    public static List<AgentToolDefinition> resolve(List<String> toolNames) {
        if (toolNames == null || toolNames.isEmpty()) {
            return Collections.emptyList();
        }
        List<AgentToolDefinition> result = new ArrayList<>(toolNames.size());
        for (String name : toolNames) {
            AgentToolDefinition definition = DEFINITIONS.get(name);
            if (definition == null) {
                throw new IllegalArgumentException("Unknown tool '" + name + "'");
            }
            result.add(definition);
        }
        return result;
    }

    private static Map<String, Object> stringProperty(String description) {
        return Map.of("type", "string", "description", description);
    }

    private static Map<String, Object> objectSchema(Map<String, Object> properties, List<String> required) {
        return Map.of("type", "object", "properties", properties, "required", required);
    }
}
