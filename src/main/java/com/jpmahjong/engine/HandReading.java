package com.jpmahjong.engine;

import com.jpmahjong.model.HandComponent;
import com.jpmahjong.model.Meld;
import com.jpmahjong.model.Tile;
import com.jpmahjong.model.WaitType;
import com.jpmahjong.model.WinForm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * 一种拆法 + 和了牌所在位置（决定听牌形），算役与算符的共同输入
 * <p>
 * 荣和时，由和了牌凑成的刻子按明刻处理。
 */
final class HandReading {
    private final WinForm form;
    private final List<HandComponent> sets;
    private final int pairValue;
    private final WaitType waitType;
    private final boolean menzen;
    private final int[] counts;     // 全部牌（暗牌 + 副露）的计数
    private final int winningValue;

    private HandReading(WinForm form, List<HandComponent> sets, WaitType waitType, boolean menzen,
                        int[] counts, int winningValue) {
        this.form = form;
        this.sets = Collections.unmodifiableList(sets);
        this.pairValue = form.getPairValue();
        this.waitType = waitType;
        this.menzen = menzen;
        this.counts = counts;
        this.winningValue = winningValue;
    }

    /**
     * 展开一种拆法的所有读法（和了牌可能落在不同的面子或雀头上）
     */
    static List<HandReading> expand(WinForm form, int winningValue, boolean tsumo, List<Meld> melds, int[] counts) {
        boolean menzen = true;
        for (Meld meld : melds) {
            if (meld.isOpen()) {
                menzen = false;
            }
        }

        List<HandReading> readings = new ArrayList<>();
        if (form.getShape() != WinForm.Shape.STANDARD) {
            readings.add(new HandReading(form, form.getSets(), WaitType.TANKI, menzen, counts, winningValue));
            return readings;
        }

        List<HandComponent> sets = form.getSets();
        int meldCount = melds.size();
        for (int i = meldCount; i < sets.size(); i++) {
            HandComponent component = sets.get(i);
            if (!component.contains(winningValue)) {
                continue;
            }
            if (component.isRun()) {
                readings.add(new HandReading(form, sets, runWait(component.getBaseValue(), winningValue),
                    menzen, counts, winningValue));
            } else {
                List<HandComponent> adjusted = new ArrayList<>(sets);
                if (!tsumo) {
                    adjusted.set(i, new HandComponent(component.getKind(), component.getBaseValue(), true));
                }
                readings.add(new HandReading(form, adjusted, WaitType.SHANPON, menzen, counts, winningValue));
            }
        }
        if (form.getPairValue() == winningValue) {
            readings.add(new HandReading(form, sets, WaitType.TANKI, menzen, counts, winningValue));
        }
        return readings;
    }

    private static WaitType runWait(int base, int winningValue) {
        if (winningValue == base + 1) {
            return WaitType.KANCHAN;
        }
        int startRank = base % 9 + 1;
        if ((winningValue == base && startRank == 7) || (winningValue == base + 2 && startRank == 1)) {
            return WaitType.PENCHAN;
        }
        return WaitType.RYANMEN;
    }

    WinForm getForm() {
        return form;
    }

    WinForm.Shape getShape() {
        return form.getShape();
    }

    List<HandComponent> getSets() {
        return sets;
    }

    int getPairValue() {
        return pairValue;
    }

    WaitType getWaitType() {
        return waitType;
    }

    boolean isMenzen() {
        return menzen;
    }

    int[] getCounts() {
        return counts;
    }

    int getWinningValue() {
        return winningValue;
    }

    int count(int value) {
        return counts[value];
    }

    /**
     * 是否所有牌都满足条件
     */
    boolean allTiles(IntPredicate predicate) {
        for (int value = 0; value < Tile.KINDS; value++) {
            if (counts[value] > 0 && !predicate.test(value)) {
                return false;
            }
        }
        return true;
    }

    boolean anyTile(IntPredicate predicate) {
        for (int value = 0; value < Tile.KINDS; value++) {
            if (counts[value] > 0 && predicate.test(value)) {
                return true;
            }
        }
        return false;
    }
}
