package com.jpmahjong.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 等待响应阶段的数据：对一张打出（或加杠）的牌，哪些座位还需表态、各自可选什么、已经声明了什么
 */
public class ResponseWindow {
    private final Tile tile;                                          // 被响应的牌
    private final int discarderSeat;                                  // 打出（加杠）的座位
    private final boolean chankan;                                    // 是否为抢杠窗口
    private final List<Integer> pendingSeats;                         // 尚未表态的座位（按行牌顺序）
    private final Map<Integer, List<Action>> options;                 // 座位 -> 可选行动
    private final Map<Integer, Action> declarations = new LinkedHashMap<>(); // 座位 -> 已声明行动

    public ResponseWindow(Tile tile, int discarderSeat, boolean chankan, Map<Integer, List<Action>> options) {
        this.tile = tile;
        this.discarderSeat = discarderSeat;
        this.chankan = chankan;
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
        this.pendingSeats = new ArrayList<>(options.keySet());
    }

    public Tile getTile() {
        return tile;
    }

    public int getDiscarderSeat() {
        return discarderSeat;
    }

    public boolean isChankan() {
        return chankan;
    }

    public List<Integer> getPendingSeats() {
        return Collections.unmodifiableList(pendingSeats);
    }

    public boolean isPending(int seat) {
        return pendingSeats.contains(seat);
    }

    public List<Action> getOptions(int seat) {
        return options.getOrDefault(seat, Collections.emptyList());
    }

    public Map<Integer, List<Action>> getOptions() {
        return options;
    }

    public Map<Integer, Action> getDeclarations() {
        return Collections.unmodifiableMap(declarations);
    }

    public void declare(int seat, Action action) {
        declarations.put(seat, action);
        pendingSeats.remove(Integer.valueOf(seat));
    }

    public boolean isComplete() {
        return pendingSeats.isEmpty();
    }

    /**
     * 该座位本可以荣和
     */
    public boolean couldRon(int seat) {
        for (Action action : getOptions(seat)) {
            if (action.getType() == ActionType.RON) {
                return true;
            }
        }
        return false;
    }
}
