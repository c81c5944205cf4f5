package com.jpmahjong.model;

/**
 * 执行一次行动的结果
 */
public final class ApplyResult {
    private final boolean accepted;        // 行动是否被接受
    private final String reason;           // 被拒绝的原因
    private final GamePhase phase;         // 执行后的阶段
    private final HandOutcome handOutcome; // 本次行动结束了单局时的结果

    private ApplyResult(boolean accepted, String reason, GamePhase phase, HandOutcome handOutcome) {
        this.accepted = accepted;
        this.reason = reason;
        this.phase = phase;
        this.handOutcome = handOutcome;
    }

    public static ApplyResult accepted(GamePhase phase, HandOutcome handOutcome) {
        return new ApplyResult(true, null, phase, handOutcome);
    }

    public static ApplyResult rejected(GamePhase phase, String reason) {
        return new ApplyResult(false, reason, phase, null);
    }

    public boolean isAccepted() {
        return accepted;
    }

    public String getReason() {
        return reason;
    }

    public GamePhase getPhase() {
        return phase;
    }

    public HandOutcome getHandOutcome() {
        return handOutcome;
    }

    @Override
    public String toString() {
        return accepted ? "ApplyResult{" + phase + (handOutcome != null ? ", " + handOutcome : "") + "}"
            : "ApplyResult{rejected: " + reason + "}";
    }
}
