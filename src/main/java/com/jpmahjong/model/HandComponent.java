package com.jpmahjong.model;

/**
 * 和牌拆解中的一个组成部分（面子或雀头）
 */
public final class HandComponent {

    /**
     * 组成部分的种类
     */
    public enum Kind {
        RUN,     // 顺子
        TRIPLET, // 刻子
        QUAD,    // 杠子
        PAIR     // 雀头
    }

    private final Kind kind;
    private final int baseValue;  // 顺子为起始牌值，其余为该牌值
    private final boolean open;   // 是否明面子（副露）

    public HandComponent(Kind kind, int baseValue, boolean open) {
        this.kind = kind;
        this.baseValue = baseValue;
        this.open = open;
    }

    /**
     * 由副露转换而来
     */
    public static HandComponent fromMeld(Meld meld) {
        switch (meld.getType()) {
            case CHI:
                return new HandComponent(Kind.RUN, meld.getBaseValue(), true);
            case PON:
                return new HandComponent(Kind.TRIPLET, meld.getBaseValue(), true);
            default:
                return new HandComponent(Kind.QUAD, meld.getBaseValue(), meld.isOpen());
        }
    }

    public Kind getKind() {
        return kind;
    }

    public int getBaseValue() {
        return baseValue;
    }

    public boolean isOpen() {
        return open;
    }

    public boolean isRun() {
        return kind == Kind.RUN;
    }

    /**
     * 刻子或杠子
     */
    public boolean isSet() {
        return kind == Kind.TRIPLET || kind == Kind.QUAD;
    }

    public boolean contains(int value) {
        if (kind == Kind.RUN) {
            return value >= baseValue && value <= baseValue + 2;
        }
        return value == baseValue;
    }

    /**
     * 是否含幺九牌（带幺九判定用）
     */
    public boolean hasTerminalOrHonor() {
        if (kind == Kind.RUN) {
            return Tile.isTerminal(baseValue) || Tile.isTerminal(baseValue + 2);
        }
        return Tile.isTerminalOrHonor(baseValue);
    }

    @Override
    public String toString() {
        return kind + "(" + baseValue + (open ? ",open" : "") + ")";
    }
}
