package io.mcgateway.protocol;

import java.util.Objects;

public record BindConfirmPayload(String platform, String code, String accountId) implements Payload {
    public BindConfirmPayload {
        platform = Objects.requireNonNull(platform, "platform");
        code = Objects.requireNonNull(code, "code");
        accountId = Objects.requireNonNull(accountId, "accountId");
    }
}
