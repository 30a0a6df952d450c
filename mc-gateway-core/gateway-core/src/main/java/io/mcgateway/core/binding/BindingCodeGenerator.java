package io.mcgateway.core.binding;

import java.security.SecureRandom;

@FunctionalInterface
public interface BindingCodeGenerator {
    String nextCode(int length);

    static BindingCodeGenerator numeric() {
        SecureRandom random = new SecureRandom();
        return length -> {
            StringBuilder code = new StringBuilder(length);
            for (int i = 0; i < length; i++) {
                code.append((char) ('0' + random.nextInt(10)));
            }
            return code.toString();
        };
    }
}
