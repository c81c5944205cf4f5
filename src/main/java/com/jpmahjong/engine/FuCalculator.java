package com.jpmahjong.engine;

import com.jpmahjong.model.HandComponent;
import com.jpmahjong.model.Tile;
import com.jpmahjong.model.WaitType;
import com.jpmahjong.model.WinContext;
import com.jpmahjong.model.WinForm;

/**
 * 符数计算
 */
final class FuCalculator {

    private FuCalculator() {
    }

    static int calculate(HandReading reading, WinContext context) {
        if (reading.getShape() == WinForm.Shape.SEVEN_PAIRS) {
            return 25;
        }
        boolean pinfu = YakuEvaluator.isPinfu(reading, context);
        if (pinfu && context.isTsumo()) {
            return 20;
        }

        int fu = 20;
        if (reading.isMenzen() && !context.isTsumo()) {
            fu += 10; // 门清荣和
        }
        if (context.isTsumo()) {
            fu += 2;  // 自摸
        }

        if (reading.getShape() == WinForm.Shape.STANDARD) {
            for (HandComponent set : reading.getSets()) {
                fu += setFu(set);
            }
            fu += pairFu(reading.getPairValue(), context);
        }

        WaitType wait = reading.getWaitType();
        if (wait == WaitType.KANCHAN || wait == WaitType.PENCHAN || wait == WaitType.TANKI) {
            fu += 2;
        }

        fu = roundUpToTen(fu);
        // 副露平和形荣和按 30 符计
        if (!reading.isMenzen() && fu == 20) {
            fu = 30;
        }
        return fu;
    }

    private static int setFu(HandComponent set) {
        int fu;
        switch (set.getKind()) {
            case TRIPLET:
                fu = set.hasTerminalOrHonor() ? 4 : 2;
                break;
            case QUAD:
                fu = set.hasTerminalOrHonor() ? 16 : 8;
                break;
            default:
                return 0;
        }
        return set.isOpen() ? fu : fu * 2;
    }

    private static int pairFu(int pairValue, WinContext context) {
        int fu = 0;
        if (pairValue >= Tile.WHITE) {
            fu += 2;
        }
        if (pairValue == Tile.EAST + context.getSeatWind()) {
            fu += 2;
        }
        if (pairValue == Tile.EAST + context.getRoundWind()) {
            fu += 2;
        }
        return fu;
    }

    static int roundUpToTen(int fu) {
        return (fu + 9) / 10 * 10;
    }
}
