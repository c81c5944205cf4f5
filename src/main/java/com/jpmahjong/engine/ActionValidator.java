package com.jpmahjong.engine;

import com.jpmahjong.config.RuleProperties;
import com.jpmahjong.model.Action;
import com.jpmahjong.model.GameState;
import com.jpmahjong.model.KanType;
import com.jpmahjong.model.Meld;
import com.jpmahjong.model.MeldType;
import com.jpmahjong.model.Player;
import com.jpmahjong.model.Tile;
import com.jpmahjong.model.Wall;
import com.jpmahjong.model.WinContext;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;

/**
 * 行动检查器 - 列出玩家在摸牌后/他家打牌后可以执行的所有合法行动，并裁决多人同时响应的优先级
 * <p>
 * 只读取对局状态，从不修改。
 */
public class ActionValidator {

    private ActionValidator() {
    }

    /**
     * 裁决结果：胜出的座位与行动
     */
    public static final class Resolution {
        private final int seat;
        private final Action action;

        public Resolution(int seat, Action action) {
            this.seat = seat;
            this.action = action;
        }

        public int getSeat() {
            return seat;
        }

        public Action getAction() {
            return action;
        }

        @Override
        public String toString() {
            return "Resolution{seat=" + seat + ", action=" + action + "}";
        }
    }

    /**
     * 摸牌后（或吃碰后）当前玩家可以执行的行动
     */
    public static List<Action> legalActionsOnDraw(GameState state, int seat, RuleProperties rules) {
        Player player = state.getPlayer(seat);
        List<Action> actions = new ArrayList<>();
        Tile drawn = player.getDrawnTile();

        // 吃碰之后没有摸牌：只能打牌
        if (drawn == null) {
            for (Tile tile : distinctTiles(player.getHandTiles())) {
                actions.add(Action.discard(tile));
            }
            return actions;
        }

        List<Tile> concealed = player.getConcealedTiles();

        // 自摸
        boolean canTsumo = false;
        if (HandAnalyzer.isWinningShape(concealed, player.getMelds())) {
            WinContext context = buildWinContext(state, seat, drawn, true, false, rules);
            canTsumo = ScoreCalculator.calculateWinDetails(concealed, player.getMelds(), drawn, context).isValid();
        }
        if (canTsumo) {
            actions.add(Action.tsumo(drawn));
        }

        // 暗杠 / 加杠
        List<Action> kans = selfKanOptions(state, player);
        actions.addAll(kans);

        // 立直：与自摸、杠互斥
        if (!canTsumo && kans.isEmpty()) {
            actions.addAll(riichiOptions(state, player, rules));
        }

        // 打牌：立直后只能摸切
        if (player.isRiichi()) {
            actions.add(Action.discard(drawn));
        } else {
            for (Tile tile : distinctTiles(concealed)) {
                actions.add(Action.discard(tile));
            }
        }

        // 九种九牌：第一巡、自己还没打过牌、无人鸣牌
        if (state.isFirstGoAround() && player.getDiscardedValues().isEmpty()
            && HandAnalyzer.countDistinctTerminalHonors(concealed) >= 9) {
            actions.add(Action.specialDraw());
        }
        return actions;
    }

    /**
     * 他家打出（或加杠）一张牌后，该座位可以执行的行动
     */
    public static List<Action> legalActionsOnResponse(GameState state, int seat, Tile tile, int discarderSeat,
                                                      boolean chankan, RuleProperties rules) {
        List<Action> actions = new ArrayList<>();
        if (seat == discarderSeat) {
            return actions;
        }
        Player player = state.getPlayer(seat);
        Wall wall = state.getWall();

        // 荣和：成形、有役、非振听
        List<Tile> withTile = new ArrayList<>(player.getHandTiles());
        withTile.add(tile);
        if (HandAnalyzer.isWinningShape(withTile, player.getMelds()) && !ScoreCalculator.isFuriten(player)) {
            WinContext context = buildWinContext(state, seat, tile, false, chankan, rules);
            context.setLoserSeat(discarderSeat);
            if (ScoreCalculator.calculateWinDetails(withTile, player.getMelds(), tile, context).isValid()) {
                actions.add(Action.ron(tile));
            }
        }

        // 鸣牌：立直后不可，河底牌不可，抢杠窗口不可
        if (!chankan && !player.isRiichi() && wall.getLiveCount() > 0) {
            int matching = 0;
            for (Tile t : player.getHandTiles()) {
                if (t.isSameAs(tile)) {
                    matching++;
                }
            }
            if (matching >= 2) {
                actions.add(Action.pon(tile));
            }
            if (matching >= 3 && canDeclareKan(state)) {
                actions.add(Action.kan(KanType.OPEN, tile));
            }
            if (seat == (discarderSeat + 1) % GameState.PLAYER_COUNT) {
                actions.addAll(chiOptions(player, tile));
            }
        }

        actions.add(Action.pass());
        return actions;
    }

    /**
     * 优先级裁决：荣和 > 碰/杠 > 吃；同优先级按 打牌者上家、对家、下家 的顺序取第一个
     * 全员过牌返回空
     */
    public static Optional<Resolution> resolve(Map<Integer, Action> declarations, int discarderSeat) {
        for (int priority = 3; priority >= 1; priority--) {
            for (int i = 1; i < GameState.PLAYER_COUNT; i++) {
                int seat = (discarderSeat - i + GameState.PLAYER_COUNT) % GameState.PLAYER_COUNT;
                Action action = declarations.get(seat);
                if (action != null && action.getType().getResponsePriority() == priority) {
                    return Optional.of(new Resolution(seat, action));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * 由对局状态构造算分用的场况
     */
    public static WinContext buildWinContext(GameState state, int seat, Tile winningTile, boolean tsumo,
                                             boolean chankan, RuleProperties rules) {
        Player player = state.getPlayer(seat);
        Wall wall = state.getWall();
        boolean lastTile = wall.getLiveCount() == 0;
        boolean firstDraw = state.isFirstGoAround() && player.getDiscardedValues().isEmpty();

        WinContext context = new WinContext();
        context.setWinnerSeat(seat);
        context.setDealerSeat(state.getDealerSeat());
        context.setSeatWind(state.seatWindOf(seat));
        context.setRoundWind(state.getRoundWind());
        context.setTsumo(tsumo);
        context.setRiichi(player.isRiichi() && !player.isDoubleRiichi());
        context.setDoubleRiichi(player.isDoubleRiichi());
        context.setIppatsu(player.isIppatsu());
        context.setRinshan(tsumo && state.isRinshanDraw());
        context.setHaitei(tsumo && lastTile && !state.isRinshanDraw());
        context.setHoutei(!tsumo && lastTile && !chankan);
        context.setChankan(chankan);
        context.setTenhou(tsumo && firstDraw && seat == state.getDealerSeat());
        context.setChiihou(tsumo && firstDraw && seat != state.getDealerSeat());
        context.setOpenTanyao(rules.isOpenTanyao());
        context.setHonba(state.getHonba());
        context.setRiichiSticks(state.getRiichiSticks());
        context.setDoraIndicators(wall.getDoraIndicators());
        context.setUraIndicators(wall.getUraIndicators());
        return context;
    }

    /**
     * 还能开杠：岭上牌未用尽且不是海底
     */
    static boolean canDeclareKan(GameState state) {
        return state.getWall().getReplacementsRemaining() > 0 && state.getWall().getLiveCount() > 0;
    }

    // === 工具方法 ===

    private static List<Action> selfKanOptions(GameState state, Player player) {
        List<Action> actions = new ArrayList<>();
        if (!canDeclareKan(state)) {
            return actions;
        }
        List<Tile> concealed = player.getConcealedTiles();
        int[] counts = HandAnalyzer.toCounts(concealed);

        // 暗杠
        for (int value = 0; value < Tile.KINDS; value++) {
            if (counts[value] == 4 && (!player.isRiichi() || riichiKanKeepsWaits(player, value))) {
                actions.add(Action.kan(KanType.CLOSED, new Tile(value)));
            }
        }

        // 加杠（立直中不可能有碰）
        for (Meld meld : player.getMelds()) {
            if (meld.getType() != MeldType.PON) {
                continue;
            }
            for (Tile tile : distinctTiles(concealed)) {
                if (tile.getValue() == meld.getBaseValue()) {
                    actions.add(Action.kan(KanType.ADDED, tile));
                }
            }
        }
        return actions;
    }

    /**
     * 立直后暗杠：只能杠摸到的牌，且杠后听牌不变
     */
    private static boolean riichiKanKeepsWaits(Player player, int value) {
        Tile drawn = player.getDrawnTile();
        if (drawn == null || drawn.getValue() != value) {
            return false;
        }
        SortedSet<Integer> before = HandAnalyzer.findWaitTiles(player.getHandTiles(), player.getMelds());

        List<Tile> afterHand = new ArrayList<>();
        List<Tile> kanTiles = new ArrayList<>();
        for (Tile tile : player.getConcealedTiles()) {
            if (tile.getValue() == value) {
                kanTiles.add(tile);
            } else {
                afterHand.add(tile);
            }
        }
        List<Meld> afterMelds = new ArrayList<>(player.getMelds());
        afterMelds.add(new Meld(MeldType.KAN_CLOSED, kanTiles, -1, null));
        SortedSet<Integer> after = HandAnalyzer.findWaitTiles(afterHand, afterMelds);
        return !before.isEmpty() && before.equals(after);
    }

    private static List<Action> riichiOptions(GameState state, Player player, RuleProperties rules) {
        List<Action> actions = new ArrayList<>();
        if (player.isRiichi() || !player.isMenzen()
            || player.getScore() < rules.getRiichiCost()
            || state.getWall().getLiveCount() < 4) {
            return actions;
        }
        List<Tile> concealed = player.getConcealedTiles();
        for (Tile discard : distinctTiles(concealed)) {
            List<Tile> remaining = new ArrayList<>(concealed);
            remaining.remove(discard);
            if (HandAnalyzer.isTenpai(remaining, player.getMelds())) {
                actions.add(Action.riichi(discard));
            }
        }
        return actions;
    }

    /**
     * 吃：x-2 x-1 x / x-1 x x+1 / x x+1 x+2 三种，手中赤牌与普通牌视为不同选择
     */
    private static List<Action> chiOptions(Player player, Tile tile) {
        Set<Action> options = new LinkedHashSet<>();
        if (tile.isHonor()) {
            return new ArrayList<>(options);
        }
        int value = tile.getValue();
        int rank = tile.getRank();
        int[][] patterns = {{-2, -1}, {-1, 1}, {1, 2}};
        for (int[] pattern : patterns) {
            int rankA = rank + pattern[0];
            int rankB = rank + pattern[1];
            if (rankA < 1 || rankB > 9) {
                continue;
            }
            for (Tile a : tilesOfValue(player.getHandTiles(), value + pattern[0])) {
                for (Tile b : tilesOfValue(player.getHandTiles(), value + pattern[1])) {
                    options.add(Action.chi(tile, a, b));
                }
            }
        }
        return new ArrayList<>(options);
    }

    private static Set<Tile> tilesOfValue(List<Tile> tiles, int value) {
        Set<Tile> result = new LinkedHashSet<>();
        for (Tile tile : tiles) {
            if (tile.getValue() == value) {
                result.add(tile);
            }
        }
        return result;
    }

    /**
     * 按（牌值，是否赤牌）去重
     */
    private static Set<Tile> distinctTiles(List<Tile> tiles) {
        List<Tile> sorted = new ArrayList<>(tiles);
        sorted.sort(null);
        return new LinkedHashSet<>(sorted);
    }
}
