package com.jpmahjong.model;

/**
 * 途中流局原因
 */
public enum AbortReason {
    NINE_TERMINALS,        // 九种九牌
    REPLACEMENT_EXHAUSTED, // 岭上牌用尽
    WALL_UNDERFLOW         // 配牌时牌墙不足
}
