package com.jpmahjong.engine;

import com.jpmahjong.model.GameState;
import com.jpmahjong.model.Meld;
import com.jpmahjong.model.Player;
import com.jpmahjong.model.Tile;
import com.jpmahjong.model.Wall;
import com.jpmahjong.model.WinContext;
import com.jpmahjong.model.WinDetails;
import com.jpmahjong.model.WinForm;
import com.jpmahjong.model.Yaku;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 算分器 - 役、番、符、宝牌、点数与支付
 * <p>
 * 纯函数：同样的输入总是得到同样的结果。
 */
public class ScoreCalculator {

    private static final Logger log = LoggerFactory.getLogger(ScoreCalculator.class);

    public static final int MANGAN = 2000;
    public static final int HANEMAN = 3000;
    public static final int BAIMAN = 4000;
    public static final int SANBAIMAN = 6000;
    public static final int YAKUMAN = 8000;

    private static final int NOTEN_PENALTY_TOTAL = 3000;

    private ScoreCalculator() {
    }

    /**
     * 计算和牌详情
     *
     * @param concealed   暗牌（含和了牌），张数为 14 - 3 × 副露数
     * @param melds       副露
     * @param winningTile 和了牌
     * @param context     场况
     */
    public static WinDetails calculateWinDetails(List<Tile> concealed, List<Meld> melds, Tile winningTile,
                                                 WinContext context) {
        List<Meld> fixed = melds == null ? Collections.emptyList() : melds;
        List<WinForm> forms = HandAnalyzer.decompose(concealed, fixed);
        if (forms.isEmpty()) {
            return WinDetails.invalid();
        }

        List<Tile> allTiles = new ArrayList<>(concealed);
        for (Meld meld : fixed) {
            allTiles.addAll(meld.getTiles());
        }
        int[] counts = HandAnalyzer.toCounts(allTiles);

        List<HandReading> readings = new ArrayList<>();
        for (WinForm form : forms) {
            readings.addAll(HandReading.expand(form, winningTile.getValue(), context.isTsumo(), fixed, counts));
        }

        // 1. 役满优先
        HandReading bestYakumanReading = null;
        Map<Yaku, Integer> bestYakuman = Collections.emptyMap();
        for (HandReading reading : readings) {
            Map<Yaku, Integer> yakuman = YakuEvaluator.evaluateYakuman(reading, context);
            if (yakuman.size() > bestYakuman.size()) {
                bestYakuman = yakuman;
                bestYakumanReading = reading;
            }
        }
        if (bestYakumanReading != null) {
            return buildYakumanDetails(bestYakumanReading, bestYakuman, context);
        }

        // 2. 普通役：取 (番, 符) 最大的读法
        HandReading bestReading = null;
        Map<Yaku, Integer> bestYaku = null;
        int bestHan = -1;
        int bestFu = -1;
        for (HandReading reading : readings) {
            Map<Yaku, Integer> yaku = YakuEvaluator.evaluate(reading, context);
            int han = sumHan(yaku);
            int fu = FuCalculator.calculate(reading, context);
            if (han > bestHan || (han == bestHan && fu > bestFu)) {
                bestReading = reading;
                bestYaku = yaku;
                bestHan = han;
                bestFu = fu;
            }
        }

        // 3. 一番缚：没有役（只有宝牌）不能和
        if (bestReading == null || bestHan <= 0) {
            log.debug("无役，不能和牌：{}", concealed);
            return WinDetails.invalid();
        }

        // 4. 宝牌
        int dora = countDora(allTiles, context.getDoraIndicators());
        int aka = 0;
        for (Tile tile : allTiles) {
            if (tile.isRed()) {
                aka++;
            }
        }
        int ura = (context.isRiichi() || context.isDoubleRiichi())
            ? countDora(allTiles, context.getUraIndicators()) : 0;
        int han = bestHan + dora + aka + ura;

        WinDetails details = new WinDetails();
        details.setValid(true);
        details.setYaku(bestYaku);
        details.setHan(han);
        details.setFu(bestFu);
        details.setDoraCount(dora);
        details.setAkaDoraCount(aka);
        details.setUraDoraCount(ura);
        details.setWinForm(bestReading.getForm());
        details.setWaitType(bestReading.getWaitType());
        applyPoints(details, basePoints(han, bestFu), context);
        return details;
    }

    /**
     * 基本点：符 × 2^(番+2)，满贯以上按固定表
     */
    public static int basePoints(int han, int fu) {
        if (han >= 13) {
            return YAKUMAN;
        }
        if (han >= 11) {
            return SANBAIMAN;
        }
        if (han >= 8) {
            return BAIMAN;
        }
        if (han >= 6) {
            return HANEMAN;
        }
        if (han == 5) {
            return MANGAN;
        }
        int base = fu * (1 << (han + 2));
        return Math.min(base, MANGAN);
    }

    /**
     * 和牌支付（百位进位），含本场与立直棒
     */
    public static Map<Integer, Integer> payments(int basePoints, WinContext context) {
        Map<Integer, Integer> changes = new TreeMap<>();
        for (int seat = 0; seat < GameState.PLAYER_COUNT; seat++) {
            changes.put(seat, 0);
        }
        int winner = context.getWinnerSeat();
        boolean dealerWin = context.isDealer();

        if (context.isTsumo()) {
            for (int seat = 0; seat < GameState.PLAYER_COUNT; seat++) {
                if (seat == winner) {
                    continue;
                }
                boolean paysDouble = dealerWin || seat == context.getDealerSeat();
                int pay = ceil100(paysDouble ? basePoints * 2 : basePoints) + context.getHonba() * 100;
                changes.merge(seat, -pay, Integer::sum);
                changes.merge(winner, pay, Integer::sum);
            }
        } else {
            int pay = ceil100(basePoints * (dealerWin ? 6 : 4)) + context.getHonba() * 300;
            changes.merge(context.getLoserSeat(), -pay, Integer::sum);
            changes.merge(winner, pay, Integer::sum);
        }

        changes.merge(winner, context.getRiichiSticks() * 1000, Integer::sum);
        return changes;
    }

    /**
     * 荒牌流局的不听罚符：听牌者平分 3000 点，不听者平摊；全员听牌或全员不听不支付
     */
    public static Map<Integer, Integer> notenPayments(boolean[] tenpai) {
        Map<Integer, Integer> changes = new TreeMap<>();
        int tenpaiCount = 0;
        for (boolean t : tenpai) {
            if (t) {
                tenpaiCount++;
            }
        }
        for (int seat = 0; seat < tenpai.length; seat++) {
            int change = 0;
            if (tenpaiCount > 0 && tenpaiCount < tenpai.length) {
                change = tenpai[seat]
                    ? NOTEN_PENALTY_TOTAL / tenpaiCount
                    : -NOTEN_PENALTY_TOTAL / (tenpai.length - tenpaiCount);
            }
            changes.put(seat, change);
        }
        return changes;
    }

    /**
     * 振听：听的牌在自己的牌河里出现过，或同巡振听，或立直后振听
     * 玩家手牌此时应为 13 - 3 × 副露数 张（不含摸到的牌）
     */
    public static boolean isFuriten(Player player) {
        if (player.isRiichiFuriten() || player.isTemporaryFuriten()) {
            return true;
        }
        for (int wait : HandAnalyzer.findWaitTiles(player.getHandTiles(), player.getMelds())) {
            if (player.getDiscardedValues().contains(wait)) {
                return true;
            }
        }
        return false;
    }

    private static WinDetails buildYakumanDetails(HandReading reading, Map<Yaku, Integer> yakuman,
                                                  WinContext context) {
        WinDetails details = new WinDetails();
        details.setValid(true);
        details.setYaku(yakuman);
        details.setYakumanCount(yakuman.size());
        details.setHan(13 * yakuman.size());
        details.setFu(FuCalculator.calculate(reading, context));
        details.setWinForm(reading.getForm());
        details.setWaitType(reading.getWaitType());
        applyPoints(details, YAKUMAN * yakuman.size(), context);
        log.info("役满！{}", yakuman.keySet());
        return details;
    }

    private static void applyPoints(WinDetails details, int basePoints, WinContext context) {
        Map<Integer, Integer> payments = payments(basePoints, context);
        int collected = 0;
        for (Map.Entry<Integer, Integer> entry : payments.entrySet()) {
            if (entry.getKey() != context.getWinnerSeat()) {
                collected -= entry.getValue();
            }
        }
        details.setBasePoints(basePoints);
        details.setPoints(collected);
        details.setPayments(payments);
    }

    private static int countDora(List<Tile> tiles, List<Tile> indicators) {
        int count = 0;
        for (Tile indicator : indicators) {
            int doraValue = Wall.doraFromIndicator(indicator.getValue());
            for (Tile tile : tiles) {
                if (tile.getValue() == doraValue) {
                    count++;
                }
            }
        }
        return count;
    }

    private static int sumHan(Map<Yaku, Integer> yaku) {
        int han = 0;
        for (int h : yaku.values()) {
            han += h;
        }
        return han;
    }

    private static int ceil100(int points) {
        return (points + 99) / 100 * 100;
    }
}
