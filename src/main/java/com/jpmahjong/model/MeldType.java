package com.jpmahjong.model;

/**
 * 副露类型
 */
public enum MeldType {
    CHI,        // 吃
    PON,        // 碰
    KAN_CLOSED, // 暗杠
    KAN_ADDED,  // 加杠
    KAN_OPEN    // 大明杠
}
