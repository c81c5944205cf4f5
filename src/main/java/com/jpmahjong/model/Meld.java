package com.jpmahjong.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 副露（吃、碰、杠），形成后不可变
 */
public final class Meld {
    private final MeldType type;      // 副露类型
    private final List<Tile> tiles;   // 组成的牌（3 或 4 张，已排序）
    private final int fromSeat;       // 被鸣牌的来源座位（暗杠为 -1）
    private final Tile calledTile;    // 鸣到的那张牌（暗杠为 null）

    public Meld(MeldType type, List<Tile> tiles, int fromSeat, Tile calledTile) {
        int expected = isKanType(type) ? 4 : 3;
        if (tiles == null || tiles.size() != expected) {
            throw new IllegalArgumentException(type + " 需要 " + expected + " 张牌：" + tiles);
        }
        List<Tile> sorted = new ArrayList<>(tiles);
        Collections.sort(sorted);
        this.type = type;
        this.tiles = Collections.unmodifiableList(sorted);
        this.fromSeat = type == MeldType.KAN_CLOSED ? -1 : fromSeat;
        this.calledTile = type == MeldType.KAN_CLOSED ? null : calledTile;
    }

    public MeldType getType() {
        return type;
    }

    public List<Tile> getTiles() {
        return tiles;
    }

    public int getFromSeat() {
        return fromSeat;
    }

    public Tile getCalledTile() {
        return calledTile;
    }

    /**
     * 最小牌值（顺子为起始牌，刻子/杠子为该牌）
     */
    public int getBaseValue() {
        return tiles.get(0).getValue();
    }

    public boolean isKan() {
        return isKanType(type);
    }

    /**
     * 是否明副露（暗杠不破门清）
     */
    public boolean isOpen() {
        return type != MeldType.KAN_CLOSED;
    }

    /**
     * 碰升级为加杠
     */
    public Meld upgradeToAddedKan(Tile added) {
        if (type != MeldType.PON || !added.isSameAs(tiles.get(0))) {
            throw new IllegalArgumentException("无法加杠：" + this + " + " + added);
        }
        List<Tile> kanTiles = new ArrayList<>(tiles);
        kanTiles.add(added);
        return new Meld(MeldType.KAN_ADDED, kanTiles, fromSeat, calledTile);
    }

    private static boolean isKanType(MeldType type) {
        return type == MeldType.KAN_CLOSED || type == MeldType.KAN_ADDED || type == MeldType.KAN_OPEN;
    }

    @Override
    public String toString() {
        return type + tiles.toString();
    }
}
