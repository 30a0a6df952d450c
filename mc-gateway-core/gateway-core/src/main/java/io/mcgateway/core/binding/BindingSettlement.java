package io.mcgateway.core.binding;

public record BindingSettlement(
    String serverId,
    String code,
    String playerUuid,
    String platform,
    String accountId,
    boolean success,
    String message
) {
}
