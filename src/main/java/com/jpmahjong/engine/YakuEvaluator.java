package com.jpmahjong.engine;

import com.jpmahjong.model.HandComponent;
import com.jpmahjong.model.Tile;
import com.jpmahjong.model.WaitType;
import com.jpmahjong.model.WinContext;
import com.jpmahjong.model.WinForm;
import com.jpmahjong.model.Yaku;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 役种判定
 */
final class YakuEvaluator {

    /** 绿一色可用的牌：23468索 + 发 */
    private static final int[] GREEN_TILES = {19, 20, 21, 23, 25, Tile.GREEN};

    private YakuEvaluator() {
    }

    /**
     * 役满判定，没有役满返回空 Map
     */
    static Map<Yaku, Integer> evaluateYakuman(HandReading reading, WinContext context) {
        Map<Yaku, Integer> result = new LinkedHashMap<>();

        if (context.isTenhou()) {
            result.put(Yaku.TENHOU, 13);
        }
        if (context.isChiihou()) {
            result.put(Yaku.CHIIHOU, 13);
        }
        if (reading.getShape() == WinForm.Shape.THIRTEEN_ORPHANS) {
            result.put(Yaku.KOKUSHI_MUSOU, 13);
        }
        if (reading.allTiles(v -> v >= 27)) {
            result.put(Yaku.TSUUIISOU, 13);
        }
        if (reading.allTiles(v -> Tile.isTerminal(v))) {
            result.put(Yaku.CHINROUTOU, 13);
        }
        if (reading.allTiles(YakuEvaluator::isGreen)) {
            result.put(Yaku.RYUUIISOU, 13);
        }

        if (reading.getShape() == WinForm.Shape.STANDARD) {
            List<HandComponent> sets = reading.getSets();
            int concealedSets = 0;
            int quads = 0;
            int dragonSets = 0;
            int windSets = 0;
            for (HandComponent set : sets) {
                if (set.isSet() && !set.isOpen()) {
                    concealedSets++;
                }
                if (set.getKind() == HandComponent.Kind.QUAD) {
                    quads++;
                }
                if (set.isSet() && set.getBaseValue() >= Tile.WHITE) {
                    dragonSets++;
                }
                if (set.isSet() && set.getBaseValue() >= Tile.EAST && set.getBaseValue() <= Tile.NORTH) {
                    windSets++;
                }
            }
            if (concealedSets == 4) {
                result.put(Yaku.SUUANKOU, 13);
            }
            if (dragonSets == 3) {
                result.put(Yaku.DAISANGEN, 13);
            }
            int pair = reading.getPairValue();
            if (windSets == 4) {
                result.put(Yaku.DAISUUSHII, 13);
            } else if (windSets == 3 && pair >= Tile.EAST && pair <= Tile.NORTH) {
                result.put(Yaku.SHOUSUUSHII, 13);
            }
            if (quads == 4) {
                result.put(Yaku.SUUKANTSU, 13);
            }
            if (reading.isMenzen() && quads == 0 && isNineGates(reading.getCounts())) {
                result.put(Yaku.CHUUREN_POUTOU, 13);
            }
        }
        return result;
    }

    /**
     * 普通役判定（不含宝牌），返回 役 -> 番数
     */
    static Map<Yaku, Integer> evaluate(HandReading reading, WinContext context) {
        Map<Yaku, Integer> result = new LinkedHashMap<>();
        boolean menzen = reading.isMenzen();

        // === 场况役 ===
        if (context.isDoubleRiichi()) {
            add(result, Yaku.DOUBLE_RIICHI, menzen);
        } else if (context.isRiichi()) {
            add(result, Yaku.RIICHI, menzen);
        }
        if (context.isIppatsu() && (context.isRiichi() || context.isDoubleRiichi())) {
            add(result, Yaku.IPPATSU, menzen);
        }
        if (context.isTsumo()) {
            add(result, Yaku.MENZEN_TSUMO, menzen);
        }
        if (context.isHaitei()) {
            add(result, Yaku.HAITEI, menzen);
        }
        if (context.isHoutei()) {
            add(result, Yaku.HOUTEI, menzen);
        }
        if (context.isRinshan()) {
            add(result, Yaku.RINSHAN_KAIHOU, menzen);
        }
        if (context.isChankan()) {
            add(result, Yaku.CHANKAN, menzen);
        }

        // === 牌形役 ===
        if (reading.allTiles(v -> !Tile.isTerminalOrHonor(v)) && (menzen || context.isOpenTanyao())) {
            add(result, Yaku.TANYAO, menzen);
        }

        if (reading.getShape() == WinForm.Shape.SEVEN_PAIRS) {
            add(result, Yaku.CHIITOITSU, menzen);
            if (reading.allTiles(v -> Tile.isTerminalOrHonor(v))) {
                add(result, Yaku.HONROUTOU, menzen);
            }
        } else if (reading.getShape() == WinForm.Shape.STANDARD) {
            evaluateStandardShape(reading, context, result);
        }

        evaluateFlush(reading, result);
        return result;
    }

    /**
     * 平和：门清、四组顺子、雀头非役牌、两面听
     */
    static boolean isPinfu(HandReading reading, WinContext context) {
        if (!reading.isMenzen() || reading.getShape() != WinForm.Shape.STANDARD) {
            return false;
        }
        for (HandComponent set : reading.getSets()) {
            if (!set.isRun()) {
                return false;
            }
        }
        return !isYakuhaiValue(reading.getPairValue(), context) && reading.getWaitType() == WaitType.RYANMEN;
    }

    private static void evaluateStandardShape(HandReading reading, WinContext context, Map<Yaku, Integer> result) {
        boolean menzen = reading.isMenzen();
        List<HandComponent> sets = reading.getSets();
        int pair = reading.getPairValue();
        int seatWindValue = Tile.EAST + context.getSeatWind();
        int roundWindValue = Tile.EAST + context.getRoundWind();

        List<Integer> runs = new ArrayList<>();
        List<Integer> triplets = new ArrayList<>();
        int concealedSets = 0;
        int quads = 0;
        int dragonSets = 0;
        for (HandComponent set : sets) {
            if (set.isRun()) {
                runs.add(set.getBaseValue());
                continue;
            }
            triplets.add(set.getBaseValue());
            if (!set.isOpen()) {
                concealedSets++;
            }
            if (set.getKind() == HandComponent.Kind.QUAD) {
                quads++;
            }
            int value = set.getBaseValue();
            if (value == Tile.WHITE) {
                add(result, Yaku.YAKUHAI_WHITE, menzen);
            } else if (value == Tile.GREEN) {
                add(result, Yaku.YAKUHAI_GREEN, menzen);
            } else if (value == Tile.RED) {
                add(result, Yaku.YAKUHAI_RED, menzen);
            }
            if (value >= Tile.WHITE) {
                dragonSets++;
            }
            if (value == seatWindValue) {
                add(result, Yaku.YAKUHAI_SEAT_WIND, menzen);
            }
            if (value == roundWindValue) {
                add(result, Yaku.YAKUHAI_ROUND_WIND, menzen);
            }
        }

        if (isPinfu(reading, context)) {
            add(result, Yaku.PINFU, menzen);
        }

        // 一杯口 / 二杯口
        if (menzen) {
            Map<Integer, Integer> runCounts = new HashMap<>();
            for (int base : runs) {
                runCounts.merge(base, 1, Integer::sum);
            }
            int identicalPairs = 0;
            for (int count : runCounts.values()) {
                identicalPairs += count / 2;
            }
            if (identicalPairs >= 2) {
                add(result, Yaku.RYANPEIKOU, menzen);
            } else if (identicalPairs == 1) {
                add(result, Yaku.IIPEIKOU, menzen);
            }
        }

        // 三色同顺 / 三色同刻
        for (int rank = 0; rank < 7; rank++) {
            if (runs.contains(rank) && runs.contains(9 + rank) && runs.contains(18 + rank)) {
                add(result, Yaku.SANSHOKU_DOUJUN, menzen);
                break;
            }
        }
        for (int rank = 0; rank < 9; rank++) {
            if (triplets.contains(rank) && triplets.contains(9 + rank) && triplets.contains(18 + rank)) {
                add(result, Yaku.SANSHOKU_DOUKOU, menzen);
                break;
            }
        }

        // 一气通贯
        for (int suitStart = 0; suitStart < 27; suitStart += 9) {
            if (runs.contains(suitStart) && runs.contains(suitStart + 3) && runs.contains(suitStart + 6)) {
                add(result, Yaku.ITTSUU, menzen);
                break;
            }
        }

        // 混全带幺九 / 纯全带幺九 / 混老头
        boolean everyPartHasTerminal = Tile.isTerminalOrHonor(pair);
        for (HandComponent set : sets) {
            everyPartHasTerminal &= set.hasTerminalOrHonor();
        }
        boolean hasHonor = reading.anyTile(v -> v >= 27);
        if (everyPartHasTerminal) {
            if (runs.isEmpty()) {
                add(result, Yaku.HONROUTOU, menzen);
            } else if (hasHonor) {
                add(result, Yaku.CHANTA, menzen);
            } else {
                add(result, Yaku.JUNCHAN, menzen);
            }
        }

        if (triplets.size() == 4) {
            add(result, Yaku.TOITOI, menzen);
        }
        if (concealedSets >= 3) {
            add(result, Yaku.SANANKOU, menzen);
        }
        if (quads == 3) {
            add(result, Yaku.SANKANTSU, menzen);
        }
        if (dragonSets == 2 && pair >= Tile.WHITE) {
            add(result, Yaku.SHOUSANGEN, menzen);
        }
    }

    /**
     * 混一色 / 清一色
     */
    private static void evaluateFlush(HandReading reading, Map<Yaku, Integer> result) {
        int suitsUsed = 0;
        for (int suitStart = 0; suitStart < 27; suitStart += 9) {
            final int start = suitStart;
            if (reading.anyTile(v -> v >= start && v < start + 9)) {
                suitsUsed++;
            }
        }
        if (suitsUsed != 1) {
            return;
        }
        if (reading.anyTile(v -> v >= 27)) {
            add(result, Yaku.HONITSU, reading.isMenzen());
        } else {
            add(result, Yaku.CHINITSU, reading.isMenzen());
        }
    }

    private static boolean isYakuhaiValue(int value, WinContext context) {
        return value >= Tile.WHITE
            || value == Tile.EAST + context.getSeatWind()
            || value == Tile.EAST + context.getRoundWind();
    }

    private static boolean isGreen(int value) {
        for (int green : GREEN_TILES) {
            if (green == value) {
                return true;
            }
        }
        return false;
    }

    /**
     * 九莲宝灯：单一数牌花色 1112345678999 + 任意一张
     */
    private static boolean isNineGates(int[] counts) {
        for (int suitStart = 0; suitStart < 27; suitStart += 9) {
            int total = 0;
            for (int i = 0; i < 9; i++) {
                total += counts[suitStart + i];
            }
            if (total != 14) {
                continue;
            }
            if (counts[suitStart] < 3 || counts[suitStart + 8] < 3) {
                return false;
            }
            for (int i = 1; i < 8; i++) {
                if (counts[suitStart + i] < 1) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    private static void add(Map<Yaku, Integer> result, Yaku yaku, boolean menzen) {
        int han = yaku.han(menzen);
        if (han > 0) {
            result.put(yaku, han);
        }
    }
}
