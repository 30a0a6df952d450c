package io.mcgateway.core.session;

public final class CloseCodes {
    public static final int NORMAL = 1000;
    public static final int SERVICE_RESTART = 1012;
    public static final int REPLACED = 4000;
    public static final int HEARTBEAT_TIMEOUT = 4008;
    public static final int MISSING_CREDENTIALS = 4401;
    public static final int INVALID_CREDENTIALS = 4403;
    public static final int DUPLICATE_SERVER = 4409;

    private CloseCodes() {
    }

    public static boolean isAuthenticationFailure(int code) {
        return code == MISSING_CREDENTIALS || code == INVALID_CREDENTIALS;
    }
}
