package com.jpmahjong.config;

import com.jpmahjong.model.Tile;

/**
 * 对局长度
 */
public enum GameLength {
    TONPUUSEN(Tile.EAST),  // 东风战
    HANCHAN(Tile.SOUTH),   // 半庄战
    ISSOUSEN(Tile.NORTH);  // 一庄战（东南西北）

    private final int lastRoundWind;

    GameLength(int lastWindTile) {
        this.lastRoundWind = lastWindTile - Tile.EAST;
    }

    /**
     * 最后一个场风（0=东 1=南 2=西 3=北）
     */
    public int getLastRoundWind() {
        return lastRoundWind;
    }
}
