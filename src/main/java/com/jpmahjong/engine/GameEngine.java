package com.jpmahjong.engine;

import com.jpmahjong.config.KanDoraTiming;
import com.jpmahjong.config.RuleProperties;
import com.jpmahjong.model.AbortReason;
import com.jpmahjong.model.Action;
import com.jpmahjong.model.ActionType;
import com.jpmahjong.model.ApplyResult;
import com.jpmahjong.model.GamePhase;
import com.jpmahjong.model.GameState;
import com.jpmahjong.model.HandOutcome;
import com.jpmahjong.model.KanType;
import com.jpmahjong.model.Meld;
import com.jpmahjong.model.MeldType;
import com.jpmahjong.model.NextHandParameters;
import com.jpmahjong.model.Player;
import com.jpmahjong.model.ResponseWindow;
import com.jpmahjong.model.Tile;
import com.jpmahjong.model.Wall;
import com.jpmahjong.model.WinContext;
import com.jpmahjong.model.WinDetails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * 游戏引擎 - 一场四人立直麻将的状态机
 * <p>
 * 所有状态修改都经由 {@link #apply(int, Action)}：先用 {@link #legalActions(int)} 校验，
 * 非法行动直接拒绝、不改动任何状态。
 */
public class GameEngine {

    private static final Logger log = LoggerFactory.getLogger(GameEngine.class);

    private static final String[] WIND_NAMES = {"东", "南", "西", "北"};

    private final RuleProperties rules;
    private GameState gameState;
    private Random random = new Random();
    private List<Tile> presetWall; // 下一局使用的预设牌山，用一次即清空

    public GameEngine(RuleProperties rules) {
        this.rules = rules;
        this.gameState = new GameState(rules.getInitialScore());
    }

    /**
     * 开始一整场：重置点数与场况，并开始第一局
     *
     * @param seed 随机种子，null 表示不固定
     */
    public void resetGame(Long seed) {
        this.random = seed == null ? new Random() : new Random(seed);
        this.gameState = new GameState(rules.getInitialScore());
        log.info("对局开始，{}，起始点数 {}，种子 {}", rules.getGameLength(), rules.getInitialScore(), seed);
        resetNewHand();
    }

    /**
     * 开始下一局：应用上一局结算得到的下一局参数，洗牌、发牌
     */
    public void resetNewHand() {
        if (gameState.isGameOver()) {
            throw new IllegalStateException("整场已结束，不能开始新的一局");
        }
        NextHandParameters next = gameState.getNextHandParameters();
        if (next != null) {
            gameState.setDealerSeat(next.getDealer());
            gameState.setRoundWind(next.getRoundWind());
            gameState.setRoundNumber(next.getRoundNumber());
            gameState.setHonba(next.getHonba());
            gameState.setRiichiSticks(next.getRiichiSticks());
        }

        // 清理上局数据
        gameState.setPhase(GamePhase.HAND_START);
        gameState.setHandOutcome(null);
        gameState.setNextHandParameters(null);
        gameState.setResponseWindow(null);
        gameState.setLastDiscardedTile(null);
        gameState.setLastDiscardSeat(-1);
        gameState.setFirstGoAround(true);
        gameState.setTurnCount(0);
        gameState.setKanCount(0);
        gameState.setPendingKanDora(0);
        gameState.setRinshanDraw(false);
        gameState.setPendingRiichiSeat(-1);
        gameState.setHandCount(gameState.getHandCount() + 1);
        for (Player player : gameState.getPlayers()) {
            player.resetForNewHand(gameState.seatWindOf(player.getSeat()));
        }

        // 1. 牌山
        Wall wall = gameState.getWall();
        if (presetWall != null) {
            wall.setupFromOrder(presetWall);
            presetWall = null;
            log.info("本局使用预设牌山");
        } else {
            wall.shuffleAndSetup(TileFactory.createFullSet(rules.getRedFivesPerSuit()), random);
        }

        // 2. 发牌
        gameState.setPhase(GamePhase.DEALING);
        if (!dealTiles()) {
            endHand(HandOutcome.abortiveDraw(AbortReason.WALL_UNDERFLOW));
            return;
        }

        // 3. 庄家先打
        gameState.setCurrentSeat(gameState.getDealerSeat());
        gameState.setPhase(GamePhase.PLAYER_DISCARD);
        log.info("{}场{}局 {}本场 开始，庄家座位 {}，宝牌指示牌 {}",
            windName(gameState.getRoundWind()), gameState.getRoundNumber(), gameState.getHonba(),
            gameState.getDealerSeat(), wall.getDoraIndicators());
    }

    /**
     * 指定下一局的牌山顺序（136 张），仅用于测试
     */
    public void setPresetWall(List<Tile> orderedTiles) {
        if (orderedTiles == null || orderedTiles.size() != Wall.TOTAL_TILES) {
            throw new IllegalArgumentException("预设牌山必须为 " + Wall.TOTAL_TILES + " 张");
        }
        this.presetWall = new ArrayList<>(orderedTiles);
    }

    /**
     * 该座位当前可以执行的所有行动；轮不到该座位时为空
     */
    public List<Action> legalActions(int seat) {
        if (seat < 0 || seat >= GameState.PLAYER_COUNT) {
            return Collections.emptyList();
        }
        switch (gameState.getPhase()) {
            case PLAYER_DISCARD:
                if (seat != gameState.getCurrentSeat()) {
                    return Collections.emptyList();
                }
                return ActionValidator.legalActionsOnDraw(gameState, seat, rules);
            case WAITING_FOR_RESPONSE:
                ResponseWindow window = gameState.getResponseWindow();
                if (window == null || !window.isPending(seat)) {
                    return Collections.emptyList();
                }
                return window.getOptions(seat);
            default:
                return Collections.emptyList();
        }
    }

    /**
     * 执行一个行动
     *
     * @return 接受时带上新阶段（和单局结果，若本行动结束了这一局）；非法行动返回拒绝且状态不变
     * @throws EngineInvariantException 引擎内部状态不一致
     */
    public ApplyResult apply(int seat, Action action) {
        GamePhase phase = gameState.getPhase();
        if (action == null || !legalActions(seat).contains(action)) {
            log.warn("非法行动：座位 {}，行动 {}，当前阶段 {}", seat, action, phase);
            return ApplyResult.rejected(phase, "非法行动：" + action);
        }

        try {
            HandOutcome outcome;
            if (phase == GamePhase.WAITING_FOR_RESPONSE) {
                outcome = declareResponse(seat, action);
            } else {
                outcome = applyTurnAction(seat, action);
            }
            checkTileConservation();
            return ApplyResult.accepted(gameState.getPhase(), outcome);
        } catch (EngineInvariantException e) {
            log.error("引擎状态异常：座位 {}，行动 {}：{}", seat, action, e.getMessage(), e);
            throw e;
        }
    }

    public HandOutcome getHandOutcome() {
        return gameState.getHandOutcome();
    }

    public boolean isGameOver() {
        return gameState.isGameOver();
    }

    public GameState getGameState() {
        return gameState;
    }

    public RuleProperties getRules() {
        return rules;
    }

    /**
     * 由本局结果推出下一局的庄家、场风、局数、本场与立直棒
     * <p>
     * 庄家和牌、荒牌流局庄家听牌、途中流局时连庄；任何流局本场 +1，闲家和牌本场清零。
     */
    public static NextHandParameters nextHandParameters(GameState state, HandOutcome outcome) {
        int dealer = state.getDealerSeat();
        boolean dealerKeeps;
        int honba;
        switch (outcome.getEndType()) {
            case TSUMO:
            case RON:
                dealerKeeps = outcome.getWinner() == dealer;
                honba = dealerKeeps ? state.getHonba() + 1 : 0;
                break;
            case EXHAUSTIVE_DRAW:
                dealerKeeps = outcome.getTenpaiSeats().contains(dealer);
                honba = state.getHonba() + 1;
                break;
            default:
                dealerKeeps = true;
                honba = state.getHonba() + 1;
                break;
        }
        int riichiSticks = outcome.isWin() ? 0 : state.getRiichiSticks();
        if (dealerKeeps) {
            return new NextHandParameters(dealer, state.getRoundWind(), state.getRoundNumber(), honba, riichiSticks);
        }

        int nextDealer = (dealer + 1) % GameState.PLAYER_COUNT;
        int roundWind = state.getRoundWind();
        int roundNumber = state.getRoundNumber() + 1;
        if (roundNumber > GameState.PLAYER_COUNT) {
            roundWind++;
            roundNumber = 1;
        }
        return new NextHandParameters(nextDealer, roundWind, roundNumber, honba, riichiSticks);
    }

    // ==================== 发牌 / 摸牌 ====================

    /**
     * 从庄家起每人 4 张 × 3 轮，再每人 1 张，庄家再摸 1 张
     */
    private boolean dealTiles() {
        Wall wall = gameState.getWall();
        int dealer = gameState.getDealerSeat();
        for (int round = 0; round < 3; round++) {
            for (int i = 0; i < GameState.PLAYER_COUNT; i++) {
                Player player = gameState.getPlayer((dealer + i) % GameState.PLAYER_COUNT);
                for (int k = 0; k < 4; k++) {
                    Tile tile = wall.drawTile();
                    if (tile == null) {
                        return false;
                    }
                    player.addTile(tile);
                }
            }
        }
        for (int i = 0; i < GameState.PLAYER_COUNT; i++) {
            Tile tile = wall.drawTile();
            if (tile == null) {
                return false;
            }
            gameState.getPlayer((dealer + i) % GameState.PLAYER_COUNT).addTile(tile);
        }
        for (Player player : gameState.getPlayers()) {
            player.sortHand();
        }
        Tile first = wall.drawTile();
        if (first == null) {
            return false;
        }
        gameState.getDealer().setDrawnTile(first);
        log.debug("发牌完成，剩余活牌 {} 张", wall.getLiveCount());
        return true;
    }

    /**
     * 轮到下一家摸牌；活牌摸完则荒牌流局
     */
    private HandOutcome drawFor(int seat) {
        Wall wall = gameState.getWall();
        if (wall.getLiveCount() == 0) {
            return exhaustiveDraw();
        }
        gameState.setPhase(GamePhase.PLAYER_DRAW);
        gameState.setCurrentSeat(seat);
        Player player = gameState.getPlayer(seat);
        player.setDrawnTile(wall.drawTile());
        player.setTemporaryFuriten(false);
        gameState.setRinshanDraw(false);
        gameState.setPhase(GamePhase.PLAYER_DISCARD);
        log.debug("座位 {} 摸牌 {}，剩余 {} 张", seat, player.getDrawnTile(), wall.getLiveCount());
        return null;
    }

    // ==================== 摸牌后的行动 ====================

    private HandOutcome applyTurnAction(int seat, Action action) {
        switch (action.getType()) {
            case DISCARD:
                return discard(seat, action.getTile(), false);
            case RIICHI:
                return discard(seat, action.getTile(), true);
            case KAN:
                return selfKan(seat, action);
            case TSUMO:
                return tsumo(seat);
            case SPECIAL_DRAW:
                log.info("座位 {} 宣告九种九牌", seat);
                return endHand(HandOutcome.abortiveDraw(AbortReason.NINE_TERMINALS));
            default:
                throw new EngineInvariantException("打牌阶段出现响应行动：" + action);
        }
    }

    private HandOutcome discard(int seat, Tile tile, boolean riichi) {
        Player player = gameState.getPlayer(seat);
        boolean firstDiscard = player.getDiscardedValues().isEmpty();

        Tile drawn = player.getDrawnTile();
        if (drawn != null && drawn.equals(tile)) {
            player.setDrawnTile(null);
        } else {
            if (!player.removeTile(tile)) {
                throw new EngineInvariantException("座位 " + seat + " 手中没有要打的牌：" + tile);
            }
            if (drawn != null) {
                player.addTile(drawn);
                player.setDrawnTile(null);
            }
        }
        player.sortHand();
        player.getDiscards().add(tile);
        player.getDiscardedValues().add(tile.getValue());

        gameState.setLastDiscardedTile(tile);
        gameState.setLastDiscardSeat(seat);
        gameState.setTurnCount(gameState.getTurnCount() + 1);
        gameState.setRinshanDraw(false);

        // 一发只到自己的下一次打牌为止
        player.setIppatsu(false);
        if (riichi) {
            player.setRiichi(true);
            player.setDoubleRiichi(gameState.isFirstGoAround() && firstDiscard);
            player.setRiichiTurn(gameState.getTurnCount());
            player.setIppatsu(true);
            gameState.setPendingRiichiSeat(seat);
            log.info("座位 {} 立直{}，宣言牌 {}", seat, player.isDoubleRiichi() ? "（两立直）" : "", tile);
        } else {
            log.debug("座位 {} 打出 {}", seat, tile);
        }

        revealPendingKanDora();
        return openResponseWindow(seat, tile);
    }

    private HandOutcome tsumo(int seat) {
        Player player = gameState.getPlayer(seat);
        Tile winningTile = player.getDrawnTile();
        WinContext context = ActionValidator.buildWinContext(gameState, seat, winningTile, true, false, rules);
        WinDetails details = ScoreCalculator.calculateWinDetails(
            player.getConcealedTiles(), player.getMelds(), winningTile, context);
        if (!details.isValid()) {
            throw new EngineInvariantException("座位 " + seat + " 的自摸在结算时不成立");
        }
        log.info("座位 {} 自摸 {}：{}番{}符 {}", seat, winningTile, details.getHan(), details.getFu(),
            details.getYaku().keySet());
        return endHand(HandOutcome.tsumo(seat, details));
    }

    private HandOutcome selfKan(int seat, Action action) {
        Player player = gameState.getPlayer(seat);
        revealPendingKanDora();

        if (action.getKanType() == KanType.CLOSED) {
            int value = action.getTile().getValue();
            mergeDrawnTile(player);
            List<Tile> kanTiles = new ArrayList<>();
            for (Tile tile : new ArrayList<>(player.getHandTiles())) {
                if (tile.getValue() == value) {
                    player.removeTile(tile);
                    kanTiles.add(tile);
                }
            }
            if (kanTiles.size() != 4) {
                throw new EngineInvariantException("暗杠需要 4 张 " + action.getTile() + "，实际 " + kanTiles.size());
            }
            player.getMelds().add(new Meld(MeldType.KAN_CLOSED, kanTiles, -1, null));
            breakFirstGoAround();
            log.info("座位 {} 暗杠 {}", seat, action.getTile());
            return replacementDraw(seat, true);
        }

        // 加杠：先给其他家抢杠的机会
        Tile added = action.getTile();
        Map<Integer, List<Action>> options = collectResponses(seat, added, true);
        if (!options.isEmpty()) {
            log.info("座位 {} 加杠 {}，等待抢杠", seat, added);
            gameState.setResponseWindow(new ResponseWindow(added, seat, true, options));
            gameState.setPhase(GamePhase.WAITING_FOR_RESPONSE);
            gameState.setCurrentSeat(gameState.getResponseWindow().getPendingSeats().get(0));
            return null;
        }
        return completeAddedKan(seat, added);
    }

    private HandOutcome completeAddedKan(int seat, Tile added) {
        Player player = gameState.getPlayer(seat);
        mergeDrawnTile(player);
        if (!player.removeTile(added)) {
            throw new EngineInvariantException("座位 " + seat + " 手中没有加杠的牌：" + added);
        }
        List<Meld> melds = player.getMelds();
        boolean upgraded = false;
        for (int i = 0; i < melds.size(); i++) {
            Meld meld = melds.get(i);
            if (meld.getType() == MeldType.PON && meld.getBaseValue() == added.getValue()) {
                melds.set(i, meld.upgradeToAddedKan(added));
                upgraded = true;
                break;
            }
        }
        if (!upgraded) {
            throw new EngineInvariantException("座位 " + seat + " 没有可以加杠的碰：" + added);
        }
        breakFirstGoAround();
        log.info("座位 {} 加杠 {}", seat, added);
        return replacementDraw(seat, false);
    }

    /**
     * 开杠后摸岭上牌并按规则翻开杠宝牌
     *
     * @param closedKan 暗杠的杠宝牌总是立即翻开
     */
    private HandOutcome replacementDraw(int seat, boolean closedKan) {
        gameState.setPhase(GamePhase.ACTION_PROCESSING);
        gameState.setKanCount(gameState.getKanCount() + 1);
        Wall wall = gameState.getWall();
        KanDoraTiming timing = rules.getKanDoraTiming();
        boolean immediate = closedKan || timing != KanDoraTiming.AFTER_DISCARD;

        if (immediate && timing == KanDoraTiming.BEFORE_REPLACEMENT) {
            wall.revealNewDora();
        }
        Tile replacement = wall.drawReplacementTile();
        if (replacement == null) {
            return endHand(HandOutcome.abortiveDraw(AbortReason.REPLACEMENT_EXHAUSTED));
        }
        if (immediate && timing != KanDoraTiming.BEFORE_REPLACEMENT) {
            wall.revealNewDora();
        }
        if (!immediate) {
            gameState.setPendingKanDora(gameState.getPendingKanDora() + 1);
        }

        Player player = gameState.getPlayer(seat);
        player.setDrawnTile(replacement);
        gameState.setRinshanDraw(true);
        gameState.setCurrentSeat(seat);
        gameState.setPhase(GamePhase.PLAYER_DISCARD);
        log.debug("座位 {} 摸岭上牌 {}", seat, replacement);
        return null;
    }

    // ==================== 响应 ====================

    /**
     * 打出一张牌后，收集其他三家的可选行动；无人能响应则直接进入下一家摸牌
     */
    private HandOutcome openResponseWindow(int discarder, Tile tile) {
        Map<Integer, List<Action>> options = collectResponses(discarder, tile, false);
        if (options.isEmpty()) {
            return afterDiscardPassed(discarder);
        }
        gameState.setResponseWindow(new ResponseWindow(tile, discarder, false, options));
        gameState.setPhase(GamePhase.WAITING_FOR_RESPONSE);
        gameState.setCurrentSeat(gameState.getResponseWindow().getPendingSeats().get(0));
        return null;
    }

    /**
     * 只保留除“过”以外还有其他选择的座位
     */
    private Map<Integer, List<Action>> collectResponses(int discarder, Tile tile, boolean chankan) {
        Map<Integer, List<Action>> options = new LinkedHashMap<>();
        for (int i = 1; i < GameState.PLAYER_COUNT; i++) {
            int seat = (discarder + i) % GameState.PLAYER_COUNT;
            List<Action> actions = ActionValidator.legalActionsOnResponse(
                gameState, seat, tile, discarder, chankan, rules);
            if (actions.size() > 1) {
                options.put(seat, actions);
            }
        }
        return options;
    }

    private HandOutcome declareResponse(int seat, Action action) {
        ResponseWindow window = gameState.getResponseWindow();
        window.declare(seat, action);
        if (!window.isComplete()) {
            gameState.setCurrentSeat(window.getPendingSeats().get(0));
            return null;
        }
        return resolveResponses(window);
    }

    private HandOutcome resolveResponses(ResponseWindow window) {
        gameState.setResponseWindow(null);
        int discarder = window.getDiscarderSeat();
        Optional<ActionValidator.Resolution> resolution =
            ActionValidator.resolve(window.getDeclarations(), discarder);

        // 能荣和却没有荣和：同巡振听，立直中则永久振听
        for (int seat : window.getOptions().keySet()) {
            boolean won = resolution.isPresent() && resolution.get().getSeat() == seat
                && resolution.get().getAction().getType() == ActionType.RON;
            if (window.couldRon(seat) && !won) {
                Player player = gameState.getPlayer(seat);
                player.setTemporaryFuriten(true);
                if (player.isRiichi()) {
                    player.setRiichiFuriten(true);
                }
                log.debug("座位 {} 见逃，进入振听", seat);
            }
        }

        if (!resolution.isPresent()) {
            if (window.isChankan()) {
                return completeAddedKan(discarder, window.getTile());
            }
            return afterDiscardPassed(discarder);
        }

        int seat = resolution.get().getSeat();
        Action action = resolution.get().getAction();
        switch (action.getType()) {
            case RON:
                return ron(seat, window);
            case PON:
                return callPon(seat, discarder, window.getTile());
            case CHI:
                return callChi(seat, discarder, action);
            case KAN:
                return callOpenKan(seat, discarder, window.getTile());
            default:
                throw new EngineInvariantException("响应裁决得到了非响应行动：" + action);
        }
    }

    private HandOutcome ron(int seat, ResponseWindow window) {
        Player player = gameState.getPlayer(seat);
        Tile tile = window.getTile();
        List<Tile> concealed = new ArrayList<>(player.getHandTiles());
        concealed.add(tile);
        WinContext context = ActionValidator.buildWinContext(gameState, seat, tile, false, window.isChankan(), rules);
        context.setLoserSeat(window.getDiscarderSeat());
        WinDetails details = ScoreCalculator.calculateWinDetails(concealed, player.getMelds(), tile, context);
        if (!details.isValid()) {
            throw new EngineInvariantException("座位 " + seat + " 的荣和在结算时不成立");
        }
        // 立直宣言牌被荣和，立直不成立，不收立直棒
        gameState.setPendingRiichiSeat(-1);
        log.info("座位 {} 荣和座位 {} 的 {}{}：{}番{}符 {}", seat, window.getDiscarderSeat(), tile,
            window.isChankan() ? "（抢杠）" : "", details.getHan(), details.getFu(), details.getYaku().keySet());
        return endHand(HandOutcome.ron(seat, window.getDiscarderSeat(), details));
    }

    private HandOutcome callPon(int seat, int discarder, Tile tile) {
        confirmPendingRiichi();
        Player player = gameState.getPlayer(seat);
        List<Tile> tiles = takeMatching(player, tile, 2);
        tiles.add(takeFromPond(discarder, tile));
        player.getMelds().add(new Meld(MeldType.PON, tiles, discarder, tile));
        afterCall(seat);
        log.info("座位 {} 碰 {}", seat, tile);
        return null;
    }

    private HandOutcome callChi(int seat, int discarder, Action action) {
        confirmPendingRiichi();
        Player player = gameState.getPlayer(seat);
        List<Tile> tiles = new ArrayList<>();
        for (Tile own : action.getChiTiles()) {
            if (!player.removeTile(own)) {
                throw new EngineInvariantException("座位 " + seat + " 手中没有吃牌用的 " + own);
            }
            tiles.add(own);
        }
        tiles.add(takeFromPond(discarder, action.getTile()));
        player.getMelds().add(new Meld(MeldType.CHI, tiles, discarder, action.getTile()));
        afterCall(seat);
        log.info("座位 {} 吃 {}（{}）", seat, action.getTile(), action.getChiTiles());
        return null;
    }

    private HandOutcome callOpenKan(int seat, int discarder, Tile tile) {
        confirmPendingRiichi();
        revealPendingKanDora();
        Player player = gameState.getPlayer(seat);
        List<Tile> tiles = takeMatching(player, tile, 3);
        tiles.add(takeFromPond(discarder, tile));
        player.getMelds().add(new Meld(MeldType.KAN_OPEN, tiles, discarder, tile));
        afterCall(seat);
        log.info("座位 {} 明杠 {}", seat, tile);
        return replacementDraw(seat, false);
    }

    /**
     * 鸣牌后：一发全部消失，第一巡结束，轮到鸣牌者打牌
     */
    private void afterCall(int seat) {
        breakFirstGoAround();
        Player player = gameState.getPlayer(seat);
        player.setTemporaryFuriten(false);
        player.sortHand();
        gameState.setCurrentSeat(seat);
        gameState.setPhase(GamePhase.PLAYER_DISCARD);
    }

    /**
     * 打出的牌无人响应：立直成立，下家摸牌
     */
    private HandOutcome afterDiscardPassed(int discarder) {
        confirmPendingRiichi();
        return drawFor((discarder + 1) % GameState.PLAYER_COUNT);
    }

    // ==================== 单局结束 ====================

    private HandOutcome exhaustiveDraw() {
        boolean[] tenpai = new boolean[GameState.PLAYER_COUNT];
        List<Integer> tenpaiSeats = new ArrayList<>();
        for (Player player : gameState.getPlayers()) {
            tenpai[player.getSeat()] = HandAnalyzer.isTenpai(player.getHandTiles(), player.getMelds());
            if (tenpai[player.getSeat()]) {
                tenpaiSeats.add(player.getSeat());
            }
        }
        log.info("荒牌流局，听牌座位：{}", tenpaiSeats);
        return endHand(HandOutcome.exhaustiveDraw(ScoreCalculator.notenPayments(tenpai), tenpaiSeats));
    }

    private HandOutcome endHand(HandOutcome outcome) {
        gameState.setResponseWindow(null);
        NextHandParameters next = nextHandParameters(gameState, outcome);

        for (Player player : gameState.getPlayers()) {
            player.addScore(outcome.getScoreChange(player.getSeat()));
        }
        if (outcome.isWin()) {
            gameState.setRiichiSticks(0);
        }
        gameState.setHandOutcome(outcome);
        gameState.setNextHandParameters(next);
        gameState.setPhase(GamePhase.HAND_OVER_SCORES);

        if (isFinalHand(next)) {
            gameState.setGameOver(true);
            gameState.setPhase(GamePhase.GAME_OVER);
            log.info("整场结束，最终点数：{}", scoresOf(gameState));
        } else {
            log.info("本局结束：{}，下一局：{}，点数：{}", outcome, next, scoresOf(gameState));
        }
        return outcome;
    }

    private boolean isFinalHand(NextHandParameters next) {
        if (rules.isBustingEndsGame()) {
            for (Player player : gameState.getPlayers()) {
                if (player.getScore() < 0) {
                    log.info("座位 {} 被飞，点数 {}", player.getSeat(), player.getScore());
                    return true;
                }
            }
        }
        return next.getRoundWind() > rules.getGameLength().getLastRoundWind();
    }

    // ==================== 工具方法 ====================

    /**
     * 立直宣言牌通过（未被荣和），扣除立直棒
     */
    private void confirmPendingRiichi() {
        int seat = gameState.getPendingRiichiSeat();
        if (seat < 0) {
            return;
        }
        gameState.getPlayer(seat).addScore(-rules.getRiichiCost());
        gameState.setRiichiSticks(gameState.getRiichiSticks() + 1);
        gameState.setPendingRiichiSeat(-1);
    }

    private void revealPendingKanDora() {
        while (gameState.getPendingKanDora() > 0) {
            gameState.getWall().revealNewDora();
            gameState.setPendingKanDora(gameState.getPendingKanDora() - 1);
        }
    }

    private void breakFirstGoAround() {
        gameState.setFirstGoAround(false);
        for (Player player : gameState.getPlayers()) {
            player.setIppatsu(false);
        }
    }

    private void mergeDrawnTile(Player player) {
        if (player.getDrawnTile() != null) {
            player.addTile(player.getDrawnTile());
            player.setDrawnTile(null);
        }
    }

    private List<Tile> takeMatching(Player player, Tile tile, int count) {
        List<Tile> taken = new ArrayList<>();
        for (Tile own : new ArrayList<>(player.getHandTiles())) {
            if (taken.size() < count && own.isSameAs(tile)) {
                player.removeTile(own);
                taken.add(own);
            }
        }
        if (taken.size() != count) {
            throw new EngineInvariantException("座位 " + player.getSeat() + " 手中 " + tile + " 不足 " + count + " 张");
        }
        return taken;
    }

    /**
     * 从打牌者的牌河取走刚打出的牌
     */
    private Tile takeFromPond(int discarder, Tile tile) {
        List<Tile> discards = gameState.getPlayer(discarder).getDiscards();
        if (discards.isEmpty() || !discards.get(discards.size() - 1).equals(tile)) {
            throw new EngineInvariantException("座位 " + discarder + " 牌河最后一张不是 " + tile);
        }
        return discards.remove(discards.size() - 1);
    }

    private void checkTileConservation() {
        int total = gameState.countAllTiles();
        if (total != Wall.TOTAL_TILES) {
            throw new EngineInvariantException("牌数不守恒：" + total);
        }
    }

    private static String scoresOf(GameState state) {
        StringBuilder sb = new StringBuilder();
        for (Player player : state.getPlayers()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(player.getSeat()).append('=').append(player.getScore());
        }
        return sb.toString();
    }

    private static String windName(int wind) {
        return WIND_NAMES[wind % WIND_NAMES.length];
    }
}
