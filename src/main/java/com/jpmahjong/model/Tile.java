package com.jpmahjong.model;

import java.util.Objects;

/**
 * 麻将牌（不可变）
 * 牌值 0-33：0-8 万，9-17 筒，18-26 索，27-30 东南西北，31-33 白发中
 */
public final class Tile implements Comparable<Tile> {

    public static final int KINDS = 34;

    public static final int EAST = 27;
    public static final int SOUTH = 28;
    public static final int WEST = 29;
    public static final int NORTH = 30;
    public static final int WHITE = 31;
    public static final int GREEN = 32;
    public static final int RED = 33;

    private static final String[] HONOR_NAMES = {"东", "南", "西", "北", "白", "发", "中"};

    private final int value;     // 牌值
    private final boolean red;   // 是否赤宝牌（只有数牌 5 可以是赤牌）

    public Tile(int value) {
        this(value, false);
    }

    public Tile(int value, boolean red) {
        if (value < 0 || value >= KINDS) {
            throw new IllegalArgumentException("牌值越界：" + value);
        }
        if (red && !(value < 27 && value % 9 == 4)) {
            throw new IllegalArgumentException("只有数牌 5 可以是赤牌：" + value);
        }
        this.value = value;
        this.red = red;
    }

    /**
     * 解析单张牌码，如 "5m"、"0p"（赤五筒）、"7z"（中）
     */
    public static Tile of(String code) {
        if (code == null || code.length() != 2) {
            throw new IllegalArgumentException("无法解析牌码：" + code);
        }
        char digit = code.charAt(0);
        char suit = Character.toLowerCase(code.charAt(1));
        if (digit < '0' || digit > '9') {
            throw new IllegalArgumentException("无法解析牌码：" + code);
        }
        int rank = digit - '0';
        boolean red = rank == 0;
        if (red) {
            rank = 5;
        }
        switch (suit) {
            case 'm':
                return new Tile(rank - 1, red);
            case 'p':
                return new Tile(9 + rank - 1, red);
            case 's':
                return new Tile(18 + rank - 1, red);
            case 'z':
                if (red || rank > 7) {
                    throw new IllegalArgumentException("无法解析牌码：" + code);
                }
                return new Tile(27 + rank - 1);
            default:
                throw new IllegalArgumentException("无法解析牌码：" + code);
        }
    }

    public int getValue() {
        return value;
    }

    public boolean isRed() {
        return red;
    }

    public Suit getSuit() {
        return suitOf(value);
    }

    /**
     * 点数：数牌 1-9，字牌按 1z-7z 编号
     */
    public int getRank() {
        return value < 27 ? value % 9 + 1 : value - 27 + 1;
    }

    public boolean isHonor() {
        return value >= 27;
    }

    public boolean isTerminal() {
        return isTerminal(value);
    }

    public boolean isTerminalOrHonor() {
        return isTerminalOrHonor(value);
    }

    /**
     * 判断两张牌是否同一种牌（不区分赤牌）
     */
    public boolean isSameAs(Tile other) {
        return other != null && this.value == other.value;
    }

    public static Suit suitOf(int value) {
        if (value < 9) {
            return Suit.MAN;
        }
        if (value < 18) {
            return Suit.PIN;
        }
        if (value < 27) {
            return Suit.SOU;
        }
        return value < 31 ? Suit.WIND : Suit.DRAGON;
    }

    public static boolean isTerminal(int value) {
        return value < 27 && (value % 9 == 0 || value % 9 == 8);
    }

    public static boolean isTerminalOrHonor(int value) {
        return value >= 27 || isTerminal(value);
    }

    /**
     * 牌码，如 "5m"，赤五为 "0m"
     */
    public String getCode() {
        if (value >= 27) {
            return (value - 27 + 1) + "z";
        }
        return (red ? 0 : getRank()) + String.valueOf(getSuit().getCode());
    }

    /**
     * 显示名称
     */
    public String getDisplayName() {
        switch (getSuit()) {
            case MAN:
                return (red ? "赤" : "") + getRank() + "万";
            case PIN:
                return (red ? "赤" : "") + getRank() + "筒";
            case SOU:
                return (red ? "赤" : "") + getRank() + "索";
            default:
                return HONOR_NAMES[value - 27];
        }
    }

    /**
     * 排序：先按牌值，同牌值普通牌在赤牌之前
     */
    @Override
    public int compareTo(Tile other) {
        if (this.value != other.value) {
            return this.value - other.value;
        }
        return Boolean.compare(this.red, other.red);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Tile)) {
            return false;
        }
        Tile tile = (Tile) o;
        return value == tile.value && red == tile.red;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, red);
    }

    @Override
    public String toString() {
        return getCode();
    }
}
