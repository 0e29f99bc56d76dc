package com.axlabs.neo.vetoshares;

/**
 * Thrown when a governance operation is rejected. The message names the operation and the reason, e.g.
 * {@code [VetoSharesGov.sponsorMember] Handle already taken}.
 */
public class GovernanceException extends RuntimeException {

    private final ErrorCode code;
    private final String method;

    public GovernanceException(ErrorCode code, String method) {
        super("[VetoSharesGov." + method + "] " + code.getDescription());
        this.code = code;
        this.method = method;
    }

    public ErrorCode getCode() {
        return code;
    }

    /**
     * @return the name of the rejected operation.
     */
    public String getMethod() {
        return method;
    }
}
