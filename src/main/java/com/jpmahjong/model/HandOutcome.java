package com.jpmahjong.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 单局结果（只在单局结束时生成）
 */
public final class HandOutcome {
    private final HandEndType endType;
    private final int winner;                         // 和牌者（流局为 -1）
    private final int loser;                          // 放铳者（非荣和为 -1）
    private final Map<Integer, Integer> scoreChanges; // 座位 -> 点数变动
    private final WinDetails winDetails;              // 和牌详情（流局为 null）
    private final List<Integer> tenpaiSeats;          // 荒牌流局时听牌的座位
    private final AbortReason abortReason;            // 途中流局原因

    private HandOutcome(HandEndType endType, int winner, int loser, Map<Integer, Integer> scoreChanges,
                        WinDetails winDetails, List<Integer> tenpaiSeats, AbortReason abortReason) {
        this.endType = endType;
        this.winner = winner;
        this.loser = loser;
        this.scoreChanges = Collections.unmodifiableMap(new TreeMap<>(scoreChanges));
        this.winDetails = winDetails;
        this.tenpaiSeats = Collections.unmodifiableList(tenpaiSeats);
        this.abortReason = abortReason;
    }

    public static HandOutcome tsumo(int winner, WinDetails details) {
        return new HandOutcome(HandEndType.TSUMO, winner, -1, details.getPayments(), details,
            Collections.emptyList(), null);
    }

    public static HandOutcome ron(int winner, int loser, WinDetails details) {
        return new HandOutcome(HandEndType.RON, winner, loser, details.getPayments(), details,
            Collections.emptyList(), null);
    }

    public static HandOutcome exhaustiveDraw(Map<Integer, Integer> scoreChanges, List<Integer> tenpaiSeats) {
        return new HandOutcome(HandEndType.EXHAUSTIVE_DRAW, -1, -1, scoreChanges, null, tenpaiSeats, null);
    }

    public static HandOutcome abortiveDraw(AbortReason reason) {
        return new HandOutcome(HandEndType.ABORTIVE_DRAW, -1, -1, Collections.emptyMap(), null,
            Collections.emptyList(), reason);
    }

    public HandEndType getEndType() {
        return endType;
    }

    public int getWinner() {
        return winner;
    }

    public int getLoser() {
        return loser;
    }

    public Map<Integer, Integer> getScoreChanges() {
        return scoreChanges;
    }

    public int getScoreChange(int seat) {
        return scoreChanges.getOrDefault(seat, 0);
    }

    public WinDetails getWinDetails() {
        return winDetails;
    }

    public List<Integer> getTenpaiSeats() {
        return tenpaiSeats;
    }

    public AbortReason getAbortReason() {
        return abortReason;
    }

    public boolean isWin() {
        return endType == HandEndType.TSUMO || endType == HandEndType.RON;
    }

    @Override
    public String toString() {
        return "HandOutcome{" + endType + ", winner=" + winner + ", loser=" + loser
            + ", scoreChanges=" + scoreChanges + (abortReason != null ? ", reason=" + abortReason : "") + "}";
    }
}
