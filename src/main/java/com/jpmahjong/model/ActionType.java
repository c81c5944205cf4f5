package com.jpmahjong.model;

/**
 * 玩家行动类型
 */
public enum ActionType {
    DISCARD(0),      // 打牌
    RIICHI(0),       // 立直（宣言并打牌）
    CHI(1),          // 吃
    PON(2),          // 碰
    KAN(2),          // 杠（暗杠/加杠/大明杠）
    TSUMO(0),        // 自摸
    RON(3),          // 荣和
    PASS(0),         // 过
    SPECIAL_DRAW(0); // 九种九牌流局

    private final int responsePriority;

    ActionType(int responsePriority) {
        this.responsePriority = responsePriority;
    }

    /**
     * 响应阶段的优先级：荣和 3 > 碰/杠 2 > 吃 1 > 过 0
     */
    public int getResponsePriority() {
        return responsePriority;
    }
}
