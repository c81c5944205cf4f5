package com.jpmahjong.model;

/**
 * 单局结束方式
 */
public enum HandEndType {
    TSUMO,           // 自摸
    RON,             // 荣和
    EXHAUSTIVE_DRAW, // 荒牌流局
    ABORTIVE_DRAW    // 途中流局
}
