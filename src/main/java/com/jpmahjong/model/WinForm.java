package com.jpmahjong.model;

import java.util.Collections;
import java.util.List;

/**
 * 一种和牌拆解（派生数据，不保存在对局状态中）
 */
public final class WinForm {

    /**
     * 和牌形
     */
    public enum Shape {
        STANDARD,        // 4 面子 + 1 雀头
        SEVEN_PAIRS,     // 七对子
        THIRTEEN_ORPHANS // 国士无双
    }

    private final Shape shape;
    private final List<HandComponent> sets;  // 面子（副露在前，暗面子在后）
    private final int pairValue;             // 雀头（七对子为 -1）
    private final List<Integer> pairs;       // 七对子的 7 个对子

    private WinForm(Shape shape, List<HandComponent> sets, int pairValue, List<Integer> pairs) {
        this.shape = shape;
        this.sets = Collections.unmodifiableList(sets);
        this.pairValue = pairValue;
        this.pairs = Collections.unmodifiableList(pairs);
    }

    public static WinForm standard(List<HandComponent> sets, int pairValue) {
        return new WinForm(Shape.STANDARD, sets, pairValue, Collections.emptyList());
    }

    public static WinForm sevenPairs(List<Integer> pairs) {
        return new WinForm(Shape.SEVEN_PAIRS, Collections.emptyList(), -1, pairs);
    }

    public static WinForm thirteenOrphans(int pairValue) {
        return new WinForm(Shape.THIRTEEN_ORPHANS, Collections.emptyList(), pairValue, Collections.emptyList());
    }

    public Shape getShape() {
        return shape;
    }

    public List<HandComponent> getSets() {
        return sets;
    }

    public int getPairValue() {
        return pairValue;
    }

    public List<Integer> getPairs() {
        return pairs;
    }

    @Override
    public String toString() {
        switch (shape) {
            case SEVEN_PAIRS:
                return "SEVEN_PAIRS" + pairs;
            case THIRTEEN_ORPHANS:
                return "THIRTEEN_ORPHANS(" + pairValue + ")";
            default:
                return "STANDARD" + sets + " pair=" + pairValue;
        }
    }
}
