package com.jpmahjong.model;

/**
 * 杠的种类
 */
public enum KanType {
    CLOSED, // 暗杠
    ADDED,  // 加杠
    OPEN;   // 大明杠

    public MeldType toMeldType() {
        switch (this) {
            case CLOSED:
                return MeldType.KAN_CLOSED;
            case ADDED:
                return MeldType.KAN_ADDED;
            default:
                return MeldType.KAN_OPEN;
        }
    }
}
