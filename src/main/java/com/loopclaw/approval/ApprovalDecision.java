package com.loopclaw.approval;

public record ApprovalDecision(boolean allowed, String reason) {

    private static final ApprovalDecision ALLOW = new ApprovalDecision(true, "");

    public static ApprovalDecision allow() {
        return ALLOW;
    }

    public static ApprovalDecision deny(String reason) {
        return new ApprovalDecision(false, reason);
    }
}
